package org.waabox.concordia.client.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.RetryPolicy;

/**
 * Sends JSON requests over {@link HttpClient} and reads JSON responses.
 *
 * <p>A status of 400 or above raises a {@link RegistryException} carrying
 * the status and body. Network errors and error statuses are retried as
 * the {@link RetryPolicy} says; the last failure is rethrown. Failures
 * computing the request headers, such as an {@link AuthenticationException},
 * are not retried.
 *
 * <p>An empty body reads as a missing node and a body that is not JSON as a
 * text node, so callers only fail when they need a field that is absent.
 *
 * <p>Thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JsonTransport {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JsonTransport.class);

  /** The request timeout used by default. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** The first status treated as an error. */
  private static final int FIRST_ERROR_STATUS = 400;

  /** The shared mapper for request and response bodies. */
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  private final HttpClient client;
  private final RetryPolicy retryPolicy;
  private final Duration timeout;

  /**
   * Creates a new transport.
   *
   * @param theClient      the HTTP client, never null
   * @param theRetryPolicy the retry policy, never null
   * @param theTimeout     the timeout of a single attempt, never null
   */
  public JsonTransport(final HttpClient theClient,
      final RetryPolicy theRetryPolicy, final Duration theTimeout) {
    client = Objects.requireNonNull(theClient, "client must not be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    timeout = Objects.requireNonNull(theTimeout, "timeout must not be null");
  }

  /**
   * Creates a transport with its own client and the default timeout.
   *
   * @param theRetryPolicy the retry policy, never null
   *
   * @return the transport, never null
   */
  public static JsonTransport create(final RetryPolicy theRetryPolicy) {
    return new JsonTransport(HttpClient.newBuilder()
        .connectTimeout(DEFAULT_TIMEOUT)
        .build(), theRetryPolicy, DEFAULT_TIMEOUT);
  }

  /**
   * Returns the mapper used for bodies.
   *
   * @return the mapper, never null
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Sends a request, retrying as configured.
   *
   * @param method  the HTTP method, never null
   * @param uri     the target, never null
   * @param body    the value to send as JSON, null for no body
   * @param headers computes the headers of each attempt, never null
   *
   * @return the response body, never null
   *
   * @throws RegistryException when every attempt failed
   */
  public JsonNode send(final String method, final URI uri, final Object body,
      final RequestHeaders headers) {
    Objects.requireNonNull(method, "method must not be null");
    Objects.requireNonNull(uri, "uri must not be null");
    Objects.requireNonNull(headers, "headers must not be null");

    final String payload = body == null ? null : write(body);

    RegistryException last = null;
    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      try {
        return attempt(method, uri, payload, headers);
      } catch (final AuthenticationException e) {
        throw e;
      } catch (final RegistryException e) {
        last = e;
      } catch (final IOException e) {
        last = new RegistryException(method + " " + uri + " failed: "
            + e.getMessage(), e);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RegistryException("Interrupted calling " + uri, e);
      }
      if (attempt < retryPolicy.maxAttempts()) {
        final Duration backoff = retryPolicy.backoffAfter(attempt);
        log.warn("{} {} failed (attempt {}/{}), retrying in {} ms: {}",
            method, uri.getPath(), attempt, retryPolicy.maxAttempts(),
            backoff.toMillis(), last.getMessage());
        sleep(backoff, uri);
      }
    }
    log.error("{} {} failed after {} attempts", method, uri.getPath(),
        retryPolicy.maxAttempts());
    throw last;
  }

  private JsonNode attempt(final String method, final URI uri,
      final String payload, final RequestHeaders headers)
      throws IOException, InterruptedException {

    final HttpRequest.Builder request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .method(method, payload == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(payload,
                StandardCharsets.UTF_8));
    headers.forMethod(method).forEach(request::setHeader);

    log.debug("{} {}", method, uri);
    final HttpResponse<String> response = client.send(request.build(),
        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

    if (response.statusCode() >= FIRST_ERROR_STATUS) {
      log.debug("{} {} returned {}: {}", method, uri.getPath(),
          response.statusCode(), response.body());
      throw new RegistryException(response.statusCode(), response.body());
    }
    return read(response.body());
  }

  /**
   * Parses a response body.
   *
   * @param body the body, may be null
   *
   * @return the parsed node, a missing node for an empty body or a text
   *         node for a body that is not JSON, never null
   */
  static JsonNode read(final String body) {
    if (body == null || body.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      return MAPPER.readTree(body);
    } catch (final JsonProcessingException e) {
      log.warn("Response is not valid JSON, keeping it as text");
      return MAPPER.getNodeFactory().textNode(body);
    }
  }

  private static String write(final Object body) {
    try {
      return MAPPER.writeValueAsString(body);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Request body is not serializable",
          e);
    }
  }

  private static void sleep(final Duration backoff, final URI uri) {
    if (backoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RegistryException("Interrupted while retrying " + uri, e);
    }
  }

  /**
   * Builds a URI from a base url, a path and query parameters.
   *
   * @param baseUrl the base url, with or without a trailing slash
   * @param path    the path, with or without a leading slash
   * @param query   the query parameters in order, never null
   *
   * @return the URI, never null
   */
  public static URI uri(final String baseUrl, final String path,
      final Map<String, ?> query) {
    final String base = baseUrl.endsWith("/")
        ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    final StringBuilder url = new StringBuilder(base);
    if (!path.startsWith("/")) {
      url.append('/');
    }
    url.append(path);
    if (!query.isEmpty()) {
      final StringJoiner params = new StringJoiner("&", "?", "");
      query.forEach((name, value) -> params.add(encode(name) + "="
          + encode(String.valueOf(value))));
      url.append(params);
    }
    return URI.create(url.toString());
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
