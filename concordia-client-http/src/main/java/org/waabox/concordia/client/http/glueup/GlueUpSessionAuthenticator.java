package org.waabox.concordia.client.http.glueup;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.client.http.AuthenticationException;
import org.waabox.concordia.client.http.Credentials;
import org.waabox.concordia.client.http.JsonTransport;
import org.waabox.concordia.client.http.RegistryException;
import org.waabox.concordia.client.http.SessionAuthenticator;

/**
 * Opens a Glue Up user session.
 *
 * <p>Posts the account email and the MD5 hex of its passphrase to
 * {@code /v2/user/session} and reads {@code value.token} and
 * {@code value.expiry} (epoch millis) from the answer. A session without an
 * expiry is treated as already expired, so it is renewed on the next
 * request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GlueUpSessionAuthenticator implements SessionAuthenticator {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GlueUpSessionAuthenticator.class);

  /** The session endpoint. */
  static final String SESSION_PATH = "/v2/user/session";

  private final JsonTransport transport;
  private final GlueUpRequestSigner signer;
  private final URI sessionUri;
  private final String email;
  private final String passphraseHash;

  /**
   * Creates a new authenticator.
   *
   * @param theTransport the transport, never null
   * @param theSigner    signs the session request, never null
   * @param theConfig    the account configuration, never null
   */
  public GlueUpSessionAuthenticator(final JsonTransport theTransport,
      final GlueUpRequestSigner theSigner, final GlueUpConfig theConfig) {
    transport = Objects.requireNonNull(theTransport,
        "transport must not be null");
    signer = Objects.requireNonNull(theSigner, "signer must not be null");
    Objects.requireNonNull(theConfig, "config must not be null");
    sessionUri = JsonTransport.uri(theConfig.baseUrl(), SESSION_PATH,
        Map.of());
    email = theConfig.email();
    passphraseHash = md5Hex(theConfig.passphrase());
  }

  @Override
  public Credentials authenticate() {
    log.info("Opening a Glue Up session for {}", email);

    final Map<String, Object> body = Map.of(
        "email", Map.of("value", email),
        "passphrase", Map.of("value", passphraseHash));

    final JsonNode response;
    try {
      response = transport.send("POST", sessionUri, body,
          method -> Map.of(GlueUpRequestSigner.HEADER, signer.sign(method)));
    } catch (final RegistryException e) {
      log.error("Glue Up authentication failed with status {}", e.status());
      throw new AuthenticationException("Authentication failed: "
          + e.getMessage(), e.status(), e.body());
    }

    final JsonNode value = response.path("value");
    final String token = value.path("token").asText("");
    if (token.isEmpty()) {
      throw new AuthenticationException(
          "No token returned in authentication response",
          RegistryException.NO_STATUS, response.toString());
    }
    final JsonNode expiry = value.path("expiry");
    final Instant expiresAt;
    if (expiry.canConvertToLong()) {
      expiresAt = Instant.ofEpochMilli(expiry.asLong());
    } else {
      log.warn("Session without expiry, it will be renewed on next use");
      expiresAt = Instant.EPOCH;
    }
    log.info("Glue Up session opened, expires at {}", expiresAt);
    return new Credentials(token, expiresAt);
  }

  static String md5Hex(final String text) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("MD5")
          .digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }
}
