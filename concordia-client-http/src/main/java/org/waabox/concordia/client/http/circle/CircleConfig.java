package org.waabox.concordia.client.http.circle;

import java.time.Duration;
import java.util.Objects;

import org.waabox.concordia.ConcordiaException;
import org.waabox.concordia.RetryPolicy;
import org.waabox.concordia.client.http.JsonTransport;

/**
 * Immutable configuration of the Circle admin API client.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder()}. Only the API token is required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CircleConfig {

  /** The admin API used when no base url is set. */
  public static final String DEFAULT_BASE_URL =
      "https://app.circle.so/api/admin/v2";

  /** The page size used when none is set. */
  private static final int DEFAULT_PER_PAGE = 100;

  /** The admin API root, never null. */
  private final String baseUrl;

  /** The bearer token, never null. */
  private final String apiToken;

  /** The email of the member owning created events, may be null. */
  private final String ownerEmail;

  /** Records per page. */
  private final int perPage;

  /** The retry policy, never null. */
  private final RetryPolicy retryPolicy;

  /** The timeout of one attempt, never null. */
  private final Duration timeout;

  private CircleConfig(final Builder builder) {
    if (builder.apiToken == null || builder.apiToken.isBlank()) {
      throw new ConcordiaException("Circle API token is not configured");
    }
    apiToken = builder.apiToken.trim();
    baseUrl = builder.baseUrl == null || builder.baseUrl.isBlank()
        ? DEFAULT_BASE_URL : builder.baseUrl.trim();
    ownerEmail = builder.ownerEmail == null || builder.ownerEmail.isBlank()
        ? null : builder.ownerEmail.trim();
    perPage = builder.perPage;
    retryPolicy = builder.retryPolicy;
    timeout = builder.timeout;
  }

  /**
   * Returns the admin API root.
   *
   * @return the base url, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the bearer token.
   *
   * @return the token, never null
   */
  public String apiToken() {
    return apiToken;
  }

  /**
   * Returns the email of the member owning created events.
   *
   * @return the email, null when not configured
   */
  public String ownerEmail() {
    return ownerEmail;
  }

  public int perPage() {
    return perPage;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** A builder for {@link CircleConfig}. */
  public static final class Builder {

    private String baseUrl;
    private String apiToken;
    private String ownerEmail;
    private int perPage = DEFAULT_PER_PAGE;
    private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
    private Duration timeout = JsonTransport.DEFAULT_TIMEOUT;

    private Builder() {
    }

    /**
     * Sets the admin API root.
     *
     * @param theBaseUrl the url, null for {@link #DEFAULT_BASE_URL}
     * @return this builder for chaining, never null
     */
    public Builder baseUrl(final String theBaseUrl) {
      baseUrl = theBaseUrl;
      return this;
    }

    public Builder apiToken(final String theApiToken) {
      apiToken = theApiToken;
      return this;
    }

    /**
     * Sets the email of the member that owns created events.
     *
     * @param theOwnerEmail the email, may be null
     * @return this builder for chaining, never null
     */
    public Builder ownerEmail(final String theOwnerEmail) {
      ownerEmail = theOwnerEmail;
      return this;
    }

    public Builder perPage(final int thePerPage) {
      if (thePerPage <= 0) {
        throw new IllegalArgumentException(
            "perPage must be greater than 0, got: " + thePerPage);
      }
      perPage = thePerPage;
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

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws ConcordiaException if the API token is missing
     */
    public CircleConfig build() {
      return new CircleConfig(this);
    }
  }
}
