package org.waabox.concordia.client.http.glueup;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Computes the {@code a} header every Glue Up request carries.
 *
 * <p>The header reads {@code v={version};k={publicKey};ts={millis};d={digest}}
 * where the digest is the hex HMAC-SHA256, keyed with the private key, of
 * the upper case method, the public key, the version and the millis
 * concatenated.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GlueUpRequestSigner {

  /** The header name. */
  public static final String HEADER = "a";

  /** The MAC algorithm. */
  private static final String ALGORITHM = "HmacSHA256";

  private final String publicKey;
  private final SecretKeySpec privateKey;
  private final String version;
  private final Clock clock;

  /**
   * Creates a new signer.
   *
   * @param thePublicKey  the public key, never null
   * @param thePrivateKey the private key, never null
   * @param theVersion    the API version, never null
   * @param theClock      the clock giving the timestamp, never null
   */
  public GlueUpRequestSigner(final String thePublicKey,
      final String thePrivateKey, final String theVersion,
      final Clock theClock) {
    publicKey = Objects.requireNonNull(thePublicKey,
        "publicKey must not be null");
    Objects.requireNonNull(thePrivateKey, "privateKey must not be null");
    privateKey = new SecretKeySpec(
        thePrivateKey.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    version = Objects.requireNonNull(theVersion, "version must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /**
   * Signs a request.
   *
   * @param method the HTTP method, never null
   *
   * @return the header value, never null
   */
  public String sign(final String method) {
    Objects.requireNonNull(method, "method must not be null");
    final long millis = clock.millis();
    final String base = method.toUpperCase(Locale.ROOT) + publicKey + version
        + millis;
    return "v=" + version + ";k=" + publicKey + ";ts=" + millis + ";d="
        + HexFormat.of().formatHex(mac().doFinal(
            base.getBytes(StandardCharsets.UTF_8)));
  }

  private Mac mac() {
    try {
      final Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(privateKey);
      return mac;
    } catch (final NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("Can not initialize " + ALGORITHM, e);
    }
  }
}
