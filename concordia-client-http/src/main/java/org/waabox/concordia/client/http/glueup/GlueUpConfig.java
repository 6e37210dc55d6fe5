package org.waabox.concordia.client.http.glueup;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import org.waabox.concordia.ConcordiaException;
import org.waabox.concordia.RetryPolicy;
import org.waabox.concordia.client.http.JsonTransport;

/**
 * Immutable configuration of the Glue Up directory client.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder()}. The base url, organization id, both API keys, the
 * account email and its passphrase are required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GlueUpConfig {

  /** The API version used when none is set. */
  private static final String DEFAULT_API_VERSION = "1.0";

  /** The page size used when none is set. */
  private static final int DEFAULT_PAGE_SIZE = 100;

  private final String baseUrl;
  private final String organizationId;
  private final String publicKey;
  private final String privateKey;
  private final String email;
  private final String passphrase;
  private final String apiVersion;
  private final int pageSize;
  private final RetryPolicy retryPolicy;
  private final Duration timeout;
  private final Clock clock;

  private GlueUpConfig(final Builder builder) {
    baseUrl = required(builder.baseUrl, "baseUrl");
    organizationId = required(builder.organizationId, "organizationId");
    publicKey = required(builder.publicKey, "publicKey");
    privateKey = required(builder.privateKey, "privateKey");
    email = required(builder.email, "email");
    passphrase = required(builder.passphrase, "passphrase");
    apiVersion = builder.apiVersion;
    pageSize = builder.pageSize;
    retryPolicy = builder.retryPolicy;
    timeout = builder.timeout;
    clock = builder.clock;
  }

  private static String required(final String value, final String name) {
    if (value == null || value.isBlank()) {
      throw new ConcordiaException("Glue Up " + name + " is not configured");
    }
    return value.trim();
  }

  public String baseUrl() {
    return baseUrl;
  }

  public String organizationId() {
    return organizationId;
  }

  public String publicKey() {
    return publicKey;
  }

  public String privateKey() {
    return privateKey;
  }

  public String email() {
    return email;
  }

  public String passphrase() {
    return passphrase;
  }

  public String apiVersion() {
    return apiVersion;
  }

  public int pageSize() {
    return pageSize;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public Duration timeout() {
    return timeout;
  }

  public Clock clock() {
    return clock;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** A builder for {@link GlueUpConfig}. */
  public static final class Builder {

    private String baseUrl;
    private String organizationId;
    private String publicKey;
    private String privateKey;
    private String email;
    private String passphrase;
    private String apiVersion = DEFAULT_API_VERSION;
    private int pageSize = DEFAULT_PAGE_SIZE;
    private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
    private Duration timeout = JsonTransport.DEFAULT_TIMEOUT;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    public Builder baseUrl(final String theBaseUrl) {
      baseUrl = theBaseUrl;
      return this;
    }

    public Builder organizationId(final String theOrganizationId) {
      organizationId = theOrganizationId;
      return this;
    }

    public Builder publicKey(final String thePublicKey) {
      publicKey = thePublicKey;
      return this;
    }

    public Builder privateKey(final String thePrivateKey) {
      privateKey = thePrivateKey;
      return this;
    }

    public Builder email(final String theEmail) {
      email = theEmail;
      return this;
    }

    public Builder passphrase(final String thePassphrase) {
      passphrase = thePassphrase;
      return this;
    }

    /**
     * Sets the API version sent in the signature header.
     *
     * @param theApiVersion the version, never null. Defaults to 1.0.
     * @return this builder for chaining, never null
     */
    public Builder apiVersion(final String theApiVersion) {
      Objects.requireNonNull(theApiVersion, "apiVersion must not be null");
      apiVersion = theApiVersion;
      return this;
    }

    /**
     * Sets how many records each page request asks for.
     *
     * @param thePageSize the page size, greater than zero. Defaults to 100.
     * @return this builder for chaining, never null
     */
    public Builder pageSize(final int thePageSize) {
      if (thePageSize <= 0) {
        throw new IllegalArgumentException(
            "pageSize must be greater than 0, got: " + thePageSize);
      }
      pageSize = thePageSize;
      return this;
    }

    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      Objects.requireNonNull(theRetryPolicy, "retryPolicy must not be null");
      retryPolicy = theRetryPolicy;
      return this;
    }

    public Builder timeout(final Duration theTimeout) {
      Objects.requireNonNull(theTimeout, "timeout must not be null");
      timeout = theTimeout;
      return this;
    }

    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      clock = theClock;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws ConcordiaException if a required setting is missing
     */
    public GlueUpConfig build() {
      return new GlueUpConfig(this);
    }
  }
}
