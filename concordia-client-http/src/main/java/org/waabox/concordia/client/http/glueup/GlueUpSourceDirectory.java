package org.waabox.concordia.client.http.glueup;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.RetryPolicy;
import org.waabox.concordia.client.http.CredentialProvider;
import org.waabox.concordia.client.http.JsonTransport;
import org.waabox.concordia.client.http.RequestHeaders;
import org.waabox.concordia.client.http.UnexpectedResponseException;
import org.waabox.concordia.source.CorporateMembershipRecord;
import org.waabox.concordia.source.IndividualMembershipRecord;
import org.waabox.concordia.source.SourceDirectory;
import org.waabox.concordia.source.SourceEvent;

/**
 * A {@link SourceDirectory} reading the Glue Up membership directory and
 * event list.
 *
 * <p>Every endpoint is a POST taking {@code projection}, {@code filter},
 * {@code order}, {@code offset} and {@code limit}. Pages are requested
 * until one comes back shorter than the page size. Records are read from
 * the {@code value} field of each answer; an answer without it raises an
 * {@link UnexpectedResponseException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GlueUpSourceDirectory implements SourceDirectory {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GlueUpSourceDirectory.class);

  static final String MEMBERS_PATH = "/membershipDirectory/members";
  static final String CORPORATE_PATH =
      "/membershipDirectory/corporateMemberships";
  static final String EVENTS_PATH = "/event/list";

  /** The header scoping directory calls to the organization. */
  static final String ORGANIZATION_HEADER = "requestOrganizationId";

  /** The header holding the session token. */
  static final String TOKEN_HEADER = "token";

  /** The event fields requested from the event list. */
  private static final List<String> EVENT_PROJECTION = List.of("id", "title",
      "subTitle", "summary", "about", "description", "language.code",
      "defaultLanguage.code", "startDateTime", "endDateTime", "venueInfo.id",
      "venueInfo.name", "venueInfo.address", "venueInfo.city",
      "venueInfo.timezone", "venueInfo.country.name",
      "venueInfo.country.code", "venueInfo.map.latitude",
      "venueInfo.map.longitude", "template.images.banner.uri",
      "template.images.headerImage.uri", "published", "openToPublic",
      "imageUrl", "coverImageUrl");

  private final GlueUpConfig config;
  private final JsonTransport transport;
  private final GlueUpRequestSigner signer;
  private final CredentialProvider credentials;

  /**
   * Creates a directory client with its own HTTP client and session.
   *
   * @param theConfig the configuration, never null
   */
  public GlueUpSourceDirectory(final GlueUpConfig theConfig) {
    this(theConfig, HttpClient.newBuilder()
        .connectTimeout(theConfig.timeout())
        .build());
  }

  /**
   * Creates a directory client over the given HTTP client.
   *
   * @param theConfig the configuration, never null
   * @param client    the HTTP client, never null
   */
  public GlueUpSourceDirectory(final GlueUpConfig theConfig,
      final HttpClient client) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    Objects.requireNonNull(client, "client must not be null");
    transport = new JsonTransport(client, theConfig.retryPolicy(),
        theConfig.timeout());
    signer = new GlueUpRequestSigner(theConfig.publicKey(),
        theConfig.privateKey(), theConfig.apiVersion(), theConfig.clock());
    final JsonTransport sessionTransport = new JsonTransport(client,
        RetryPolicy.of(1, Duration.ZERO), theConfig.timeout());
    credentials = new GlueUpCredentialProvider(
        new GlueUpSessionAuthenticator(sessionTransport, signer, theConfig),
        theConfig.clock());
  }

  @Override
  public List<IndividualMembershipRecord> listAllIndividualMembers() {
    final List<IndividualMembershipRecord> members = fetchAll(MEMBERS_PATH,
        List.of(), List.of(), Map.of("familyName", "asc"), true,
        new TypeReference<IndividualMembershipRecord>() { });
    log.info("Fetched {} individual members", members.size());
    return members;
  }

  @Override
  public List<CorporateMembershipRecord> listAllCorporateMemberships() {
    final List<CorporateMembershipRecord> corporates = fetchAll(
        CORPORATE_PATH, List.of(), List.of(), Map.of("name", "asc"), true,
        new TypeReference<CorporateMembershipRecord>() { });
    log.info("Fetched {} corporate memberships", corporates.size());
    return corporates;
  }

  @Override
  public List<SourceEvent> listEvents(final boolean publishedOnly,
      final boolean futureOnly) {
    final List<Map<String, Object>> filters = new ArrayList<>();
    if (publishedOnly) {
      filters.add(filter("published", "eq", true));
    }
    if (futureOnly) {
      filters.add(filter("endDateTime", "gt", config.clock().millis()));
    }
    final List<SourceEvent> events = fetchAll(EVENTS_PATH, EVENT_PROJECTION,
        filters, Map.of("startDateTime", "asc"), false,
        new TypeReference<SourceEvent>() { });
    log.info("Fetched {} events from Glue Up (publishedOnly={},"
        + " futureOnly={})", events.size(), publishedOnly, futureOnly);
    return events;
  }

  private <T> List<T> fetchAll(final String path,
      final List<String> projection, final List<Map<String, Object>> filters,
      final Map<String, String> order, final boolean scoped,
      final TypeReference<T> type) {
    final URI uri = JsonTransport.uri(config.baseUrl(), path, Map.of());
    final JavaType listType = JsonTransport.mapper().getTypeFactory()
        .constructCollectionType(List.class,
            JsonTransport.mapper().getTypeFactory().constructType(type));
    final RequestHeaders headers = headers(scoped);

    final List<T> all = new ArrayList<>();
    int offset = 0;
    while (true) {
      final Map<String, Object> body = new LinkedHashMap<>();
      body.put("projection", projection);
      body.put("filter", filters);
      body.put("order", order);
      body.put("offset", offset);
      body.put("limit", config.pageSize());

      final JsonNode records = envelope(path,
          transport.send("POST", uri, body, headers));
      final List<T> page = JsonTransport.mapper().convertValue(records,
          listType);
      all.addAll(page);
      if (page.size() < config.pageSize()) {
        return all;
      }
      offset += config.pageSize();
    }
  }

  private RequestHeaders headers(final boolean scoped) {
    return method -> {
      final Map<String, String> headers = new LinkedHashMap<>();
      headers.put(GlueUpRequestSigner.HEADER, signer.sign(method));
      headers.put(TOKEN_HEADER, credentials.currentCredentials().token());
      if (scoped) {
        headers.put(ORGANIZATION_HEADER, config.organizationId());
      }
      return headers;
    };
  }

  private static JsonNode envelope(final String path, final JsonNode response) {
    final JsonNode value = response.get("value");
    if (value == null || !value.isArray()) {
      throw new UnexpectedResponseException(
          "Expected a 'value' array from " + path, response.toString());
    }
    return value;
  }

  private static Map<String, Object> filter(final String projection,
      final String operator, final Object value) {
    final Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("projection", projection);
    filter.put("operator", operator);
    filter.put("values", List.of(value));
    return filter;
  }
}
