package org.waabox.concordia.client.http.circle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.waabox.concordia.ConcordiaException;
import org.waabox.concordia.RetryPolicy;
import org.waabox.concordia.client.http.JsonTransport;
import org.waabox.concordia.client.http.StubServer;
import org.waabox.concordia.client.http.UnexpectedResponseException;
import org.waabox.concordia.target.CreatedEvent;
import org.waabox.concordia.target.EventPayload;
import org.waabox.concordia.target.Page;
import org.waabox.concordia.target.Space;
import org.waabox.concordia.target.TargetMember;

/**
 * Tests for {@link CircleTargetRegistry}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CircleTargetRegistryTest {

  private static CircleTargetRegistry registry(final StubServer server,
      final String ownerEmail) {
    return new CircleTargetRegistry(CircleConfig.builder()
        .baseUrl(server.baseUrl())
        .apiToken("secret-token")
        .ownerEmail(ownerEmail)
        .perPage(2)
        .retryPolicy(RetryPolicy.of(1, Duration.ZERO))
        .build());
  }

  @Test
  void whenListingSpaces_givenNextPage_shouldFollowIt() throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/spaces", 200, "{\"records\":[{\"id\":1,\"name\":\"A\"},"
              + "{\"id\":2,\"name\":\"B\"}],\"has_next_page\":true}")
          .respond("/spaces", 200, "{\"records\":[{\"id\":3,\"name\":\"C\"}],"
              + "\"has_next_page\":false}");

      final List<Space> spaces = registry(server, null).listSpaces();

      assertEquals(List.of(new Space("1", "A"), new Space("2", "B"),
          new Space("3", "C")), spaces);
      final List<StubServer.Recorded> calls = server.requests("/spaces");
      assertEquals("page=2&per_page=2", calls.get(1).query());
      assertEquals("Bearer secret-token", calls.get(0).header("Authorization"));
    }
  }

  @Test
  void whenListingSpaceMembers_shouldReturnOnePage() throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/space_members", 200, "{\"records\":[{\"id\":7,"
          + "\"email\":\"a@x.com\"}],\"has_next_page\":false}");

      final Page<TargetMember> page = registry(server, null)
          .listSpaceMembers("55", 3);

      assertEquals(List.of(new TargetMember("7", "a@x.com")), page.records());
      assertFalse(page.hasMore());
      assertEquals("space_id=55&page=3&per_page=2",
          server.requests("/space_members").get(0).query());
    }
  }

  @Test
  void whenInviting_shouldSplitTheNameAndSkipEmptyLists() throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/community_members", 200, "{}");

      registry(server, null).inviteMember("a@x.com", "  Ana  de la Torre ",
          List.of("10"), List.of());

      final JsonNode body = JsonTransport.mapper().readTree(
          server.requests("/community_members").get(0).body());
      assertEquals("Ana", body.path("first_name").asText());
      assertEquals("de la Torre", body.path("last_name").asText());
      assertEquals("10", body.path("space_ids").get(0).asText());
      assertFalse(body.has("tags"));
    }
  }

  @Test
  void whenRemovingFromSpace_shouldSendEmailAndSpaceAsQuery()
      throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/space_members", 200, "{}");

      registry(server, null).removeMemberFromSpace("a+b@x.com", "9");

      final StubServer.Recorded call = server.requests("/space_members")
          .get(0);
      assertEquals("DELETE", call.method());
      assertEquals("email=a%2Bb%40x.com&space_id=9", call.query());
    }
  }

  @Test
  void whenCreatingEvent_givenNestedAnswer_shouldReadIdAndSlug()
      throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/events", 200,
          "{\"event\":{\"id\":901,\"slug\":\"launch-42\"}}");

      final CreatedEvent created = registry(server, null)
          .createEvent(payload(), "12");

      assertEquals(new CreatedEvent("901", "launch-42"), created);
      final StubServer.Recorded call = server.requests("/events").get(0);
      assertEquals("space_id=12", call.query());
      final JsonNode body = JsonTransport.mapper().readTree(call.body());
      assertEquals("Launch", body.path("name").asText());
      assertEquals("owner-1", body.path("user_id").asText());
      assertFalse(body.has("cover_image_url"));
    }
  }

  @Test
  void whenCreatingEvent_givenFlatAnswerWithoutSlug_shouldReadId()
      throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/events", 201, "{\"id\":\"902\"}");

      final CreatedEvent created = registry(server, null)
          .createEvent(payload(), "12");

      assertEquals("902", created.id());
      assertNull(created.slug());
    }
  }

  @Test
  void whenDeletingEvent_shouldTargetTheEventPath() throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/events/901", 200, "");

      registry(server, null).deleteEvent("901", "12");

      final StubServer.Recorded call = server.requests("/events/901").get(0);
      assertEquals("DELETE", call.method());
      assertEquals("space_id=12", call.query());
    }
  }

  @Test
  void whenResolvingOwner_givenConfiguredEmail_shouldMatchIgnoringCase()
      throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/community_members", 200, "{\"records\":["
          + "{\"id\":1,\"email\":\"x@x.com\"},"
          + "{\"id\":2,\"email\":\"Owner@X.com\"}],\"has_next_page\":false}");

      assertEquals("2", registry(server, " owner@x.com").resolveOwnerIdentity());
    }
  }

  @Test
  void whenResolvingOwner_givenUnknownEmail_shouldFail() throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/community_members", 200,
          "{\"records\":[],\"has_next_page\":false}");

      assertThrows(ConcordiaException.class,
          () -> registry(server, "owner@x.com").resolveOwnerIdentity());
      assertThrows(ConcordiaException.class,
          () -> registry(server, null).resolveOwnerIdentity());
    }
  }

  @Test
  void whenListing_givenNoRecords_shouldRaiseUnexpectedResponse()
      throws Exception {
    try (StubServer server = new StubServer()) {
      server.respond("/spaces", 200, "{\"data\":[]}");

      final UnexpectedResponseException error = assertThrows(
          UnexpectedResponseException.class,
          () -> registry(server, null).listSpaces());
      assertTrue(error.body().contains("data"));
    }
  }

  @Test
  void whenBuildingConfig_givenNoToken_shouldFail() {
    assertThrows(ConcordiaException.class,
        () -> CircleConfig.builder().build());
  }

  private static EventPayload payload() {
    return new EventPayload("Launch", "launch-42", "<p>x</p>",
        "2026-04-01T10:00:00.000Z", "2026-04-01T12:00:00.000Z", "Hall",
        "in_person", "owner-1", false, true, true, "owner-1", "12", null,
        null, null, null, null, null, null, null);
  }
}
