package org.waabox.concordia.client.http.circle;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.ConcordiaException;
import org.waabox.concordia.client.http.JsonTransport;
import org.waabox.concordia.client.http.RequestHeaders;
import org.waabox.concordia.client.http.UnexpectedResponseException;
import org.waabox.concordia.member.Emails;
import org.waabox.concordia.target.CreatedEvent;
import org.waabox.concordia.target.EventPayload;
import org.waabox.concordia.target.Page;
import org.waabox.concordia.target.Space;
import org.waabox.concordia.target.TargetMember;
import org.waabox.concordia.target.TargetRegistry;

/**
 * A {@link TargetRegistry} over the Circle admin API.
 *
 * <p>Requests carry a bearer token. Listings are paged with {@code page}
 * and {@code per_page} and answer {@code {records: [...], has_next_page}};
 * an answer without {@code records} raises an
 * {@link UnexpectedResponseException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CircleTargetRegistry implements TargetRegistry {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CircleTargetRegistry.class);

  static final String MEMBERS_PATH = "/community_members";
  static final String SPACE_MEMBERS_PATH = "/space_members";
  static final String SPACES_PATH = "/spaces";
  static final String EVENTS_PATH = "/events";

  private final CircleConfig config;
  private final JsonTransport transport;
  private final RequestHeaders headers;

  /**
   * Creates a registry client with its own HTTP client.
   *
   * @param theConfig the configuration, never null
   */
  public CircleTargetRegistry(final CircleConfig theConfig) {
    this(theConfig, HttpClient.newBuilder()
        .connectTimeout(theConfig.timeout())
        .build());
  }

  /**
   * Creates a registry client over the given HTTP client.
   *
   * @param theConfig the configuration, never null
   * @param client    the HTTP client, never null
   */
  public CircleTargetRegistry(final CircleConfig theConfig,
      final HttpClient client) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    Objects.requireNonNull(client, "client must not be null");
    transport = new JsonTransport(client, theConfig.retryPolicy(),
        theConfig.timeout());
    final Map<String, String> bearer = Map.of("Authorization",
        "Bearer " + theConfig.apiToken());
    headers = method -> bearer;
  }

  @Override
  public List<Space> listSpaces() {
    final List<Space> spaces = fetchAll(SPACES_PATH, Map.of(),
        record -> new Space(record.path("id").asText(),
            record.path("name").asText("")));
    log.info("Fetched {} spaces", spaces.size());
    return spaces;
  }

  @Override
  public Page<TargetMember> listSpaceMembers(final String spaceId,
      final int page) {
    Objects.requireNonNull(spaceId, "spaceId must not be null");
    final Map<String, Object> query = new LinkedHashMap<>();
    query.put("space_id", spaceId);
    return page(SPACE_MEMBERS_PATH, query, page, CircleTargetRegistry::member);
  }

  @Override
  public void addMemberToSpace(final String email, final String spaceId) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("email", email);
    body.put("space_id", spaceId);
    send("POST", SPACE_MEMBERS_PATH, Map.of(), body);
    log.info("Added {} to space {}", email, spaceId);
  }

  @Override
  public void removeMemberFromSpace(final String email, final String spaceId) {
    final Map<String, Object> query = new LinkedHashMap<>();
    query.put("email", email);
    query.put("space_id", spaceId);
    send("DELETE", SPACE_MEMBERS_PATH, query, null);
    log.info("Removed {} from space {}", email, spaceId);
  }

  @Override
  public void inviteMember(final String email, final String name,
      final List<String> spaceIds, final List<String> tags) {
    Objects.requireNonNull(email, "email must not be null");
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("email", email);
    if (name != null && !name.isBlank()) {
      final String[] parts = name.trim().split("\\s+", 2);
      body.put("first_name", parts[0]);
      body.put("last_name", parts.length > 1 ? parts[1] : "");
    }
    if (spaceIds != null && !spaceIds.isEmpty()) {
      body.put("space_ids", spaceIds);
    }
    if (tags != null && !tags.isEmpty()) {
      body.put("tags", tags);
    }
    send("POST", MEMBERS_PATH, Map.of(), body);
    log.info("Invited {}", email);
  }

  @Override
  public List<TargetMember> listAllMembers() {
    final List<TargetMember> members = fetchAll(MEMBERS_PATH, Map.of(),
        CircleTargetRegistry::member);
    log.info("Fetched {} community members", members.size());
    return members;
  }

  @Override
  public CreatedEvent createEvent(final EventPayload payload,
      final String spaceId) {
    Objects.requireNonNull(payload, "payload must not be null");
    Objects.requireNonNull(spaceId, "spaceId must not be null");
    final JsonNode response = send("POST", EVENTS_PATH,
        Map.of("space_id", spaceId), payload);

    final JsonNode event = response.has("event")
        ? response.get("event") : response;
    final JsonNode id = event.get("id");
    if (id == null || id.isNull() || id.asText().isEmpty()) {
      throw new UnexpectedResponseException(
          "Expected an event id from " + EVENTS_PATH, response.toString());
    }
    final JsonNode slug = event.get("slug");
    return new CreatedEvent(id.asText(),
        slug == null || slug.isNull() ? null : slug.asText());
  }

  @Override
  public void updateEvent(final String eventId, final EventPayload payload) {
    Objects.requireNonNull(eventId, "eventId must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    send("PUT", EVENTS_PATH + "/" + eventId, Map.of(), payload);
  }

  @Override
  public void deleteEvent(final String eventId, final String spaceId) {
    Objects.requireNonNull(eventId, "eventId must not be null");
    send("DELETE", EVENTS_PATH + "/" + eventId,
        spaceId == null ? Map.of() : Map.of("space_id", spaceId), null);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Looks the configured owner email up among all community members.
   *
   * @throws ConcordiaException if no owner email is configured or no
   *                            member has it
   */
  @Override
  public String resolveOwnerIdentity() {
    final String ownerEmail = config.ownerEmail();
    if (ownerEmail == null) {
      throw new ConcordiaException(
          "No event owner configured: set the Circle owner email or pass"
              + " an owner id");
    }
    final String wanted = Emails.normalize(ownerEmail);
    for (final TargetMember member : listAllMembers()) {
      if (wanted.equals(Emails.normalize(member.email()))
          && member.id() != null) {
        log.info("Resolved event owner {} to member {}", ownerEmail,
            member.id());
        return member.id();
      }
    }
    throw new ConcordiaException("Event owner " + ownerEmail
        + " is not a community member");
  }

  private <T> List<T> fetchAll(final String path,
      final Map<String, Object> query, final Function<JsonNode, T> reader) {
    final List<T> all = new ArrayList<>();
    int pageNumber = 1;
    Page<T> page;
    do {
      page = page(path, query, pageNumber, reader);
      all.addAll(page.records());
      pageNumber++;
    } while (page.hasMore());
    return all;
  }

  private <T> Page<T> page(final String path, final Map<String, Object> query,
      final int pageNumber, final Function<JsonNode, T> reader) {
    final Map<String, Object> params = new LinkedHashMap<>(query);
    params.put("page", pageNumber);
    params.put("per_page", config.perPage());

    final JsonNode response = send("GET", path, params, null);
    final JsonNode records = response.get("records");
    if (records == null || !records.isArray()) {
      throw new UnexpectedResponseException(
          "Expected a 'records' array from " + path, response.toString());
    }
    final List<T> items = new ArrayList<>(records.size());
    for (final JsonNode record : records) {
      items.add(reader.apply(record));
    }
    return new Page<>(items, response.path("has_next_page").asBoolean(false));
  }

  private JsonNode send(final String method, final String path,
      final Map<String, ?> query, final Object body) {
    final URI uri = JsonTransport.uri(config.baseUrl(), path, query);
    return transport.send(method, uri, body, headers);
  }

  private static TargetMember member(final JsonNode record) {
    final JsonNode id = record.get("id");
    return new TargetMember(id == null || id.isNull() ? null : id.asText(),
        record.path("email").asText(""));
  }
}
