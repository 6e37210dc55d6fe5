package org.waabox.concordia.server.application;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import org.waabox.concordia.Concordia;
import org.waabox.concordia.source.Contact;
import org.waabox.concordia.source.EmailAddress;
import org.waabox.concordia.source.IndividualMembershipRecord;
import org.waabox.concordia.source.Membership;
import org.waabox.concordia.source.MembershipType;
import org.waabox.concordia.source.SourceDirectory;
import org.waabox.concordia.target.Space;

/**
 * Tests for the REST controllers, run through {@link MockMvc} over a
 * real {@link Concordia} wired to stub collaborators.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConcordiaEndpointsTest {

  private StubRegistry registry;

  private Concordia concordia;

  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    final SourceDirectory directory = createMock(SourceDirectory.class);
    expect(directory.listAllIndividualMembers()).andReturn(List.of(
        new IndividualMembershipRecord(
            new Membership(null, "active", new MembershipType("Gold", null)),
            new Contact(new EmailAddress("ana@x.com"), "Ana", "Perez"))))
        .anyTimes();
    expect(directory.listAllCorporateMemberships()).andReturn(List.of())
        .anyTimes();
    replay(directory);

    registry = new StubRegistry(new Space("1", "General"));
    concordia = Concordia.builder()
        .sourceDirectory(directory)
        .targetRegistry(registry)
        .build();
    concordia.start();

    mvc = MockMvcBuilders.standaloneSetup(
            new SyncController(concordia),
            new WebhookController(concordia),
            new AdminController(concordia))
        .setControllerAdvice(new ErrorHandler())
        .build();
  }

  @AfterEach
  void tearDown() {
    concordia.stop();
  }

  @Test
  void whenCheckingHealth_shouldAnswerOk() throws Exception {
    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true));
  }

  @Test
  void whenListingSpaces_shouldReturnIdsAndNames() throws Exception {
    mvc.perform(get("/spaces"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("1"))
        .andExpect(jsonPath("$[0].name").value("General"));
  }

  @Test
  void whenSyncingMembers_givenNoBody_shouldOnlyReport() throws Exception {
    mvc.perform(post("/sync/members"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.invited").value(1))
        .andExpect(jsonPath("$.details[0].action").value("invite_member"))
        .andExpect(jsonPath("$.details[0].outcome").value("dry_run"));

    assertTrue(registry.invited().isEmpty());
  }

  @Test
  void whenSyncingMembers_givenDryRunFalse_shouldInvite() throws Exception {
    mvc.perform(post("/sync/members")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"dry_run\": false}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.invited").value(1));

    assertEquals(List.of("ana@x.com"), registry.invited());
  }

  @Test
  void whenSyncingEvents_givenNoEventSpace_shouldAnswerError()
      throws Exception {
    mvc.perform(post("/sync/events")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"dry_run\": true, \"owner_id\": \"7\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").isNotEmpty());
  }

  @Test
  void whenReceivingWebhook_givenSameIdTwice_shouldSkipTheSecond()
      throws Exception {
    mvc.perform(post("/webhooks/glueup")
            .header(WebhookController.ID_HEADER, "wh-1")
            .header(WebhookController.TIMESTAMP_HEADER, "1700000000")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"member\": 1}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.received").value(true))
        .andExpect(jsonPath("$.skipped").value(false))
        .andExpect(jsonPath("$.webhook_id").value("wh-1"))
        .andExpect(jsonPath("$.sync_report.invited").value(1));

    mvc.perform(post("/webhooks/glueup")
            .header(WebhookController.ID_HEADER, "wh-1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"member\": 1}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.skipped").value(true))
        .andExpect(jsonPath("$.sync_report").doesNotExist());

    assertEquals(List.of("ana@x.com"), registry.invited());

    mvc.perform(get("/cache/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.webhooks_count").value(1))
        .andExpect(jsonPath("$.members_count").value(1));
  }

  @Test
  void whenValidatingCache_givenNothingCached_shouldReportNoIssues()
      throws Exception {
    mvc.perform(post("/cache/validate").param("repair", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(0))
        .andExpect(jsonPath("$.missing_in_cache").value(0));
  }

  @Test
  void whenParsingTimestamp_givenSupportedShapes_shouldReadThem() {
    assertEquals(Instant.ofEpochSecond(1700000000L),
        WebhookController.parseTimestamp("1700000000"));
    assertEquals(Instant.parse("2026-03-01T12:00:00Z"),
        WebhookController.parseTimestamp("2026-03-01T12:00:00Z"));
    assertNull(WebhookController.parseTimestamp("yesterday"));
    assertNull(WebhookController.parseTimestamp(" "));
  }

  @Test
  void whenCreating_givenNullConcordia_shouldThrowException() {
    assertThrows(NullPointerException.class,
        () -> new SyncController(null));
  }
}
