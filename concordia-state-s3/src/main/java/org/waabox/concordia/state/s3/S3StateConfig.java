package org.waabox.concordia.state.s3;

import java.util.Objects;
import java.util.Optional;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Where {@link S3StateStore} keeps the state document: a bucket, an object
 * key and a region.
 *
 * <p>A client passed through {@link Builder#s3Client(S3Client)} is used
 * as is and left open by the store; otherwise the store builds its own for
 * the region.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3StateConfig {

  /** The object key used when none is configured. */
  private static final String DEFAULT_KEY = "concordia/state.json";

  private final String bucket;
  private final String key;
  private final Region region;

  /** Supplied by the caller, null to let the store build one. */
  private final S3Client s3Client;

  private S3StateConfig(final Builder builder) {
    bucket = Objects.requireNonNull(builder.bucket,
        "bucket must not be null");
    region = Objects.requireNonNull(builder.region,
        "region must not be null");
    key = builder.key != null && !builder.key.isBlank()
        ? builder.key : DEFAULT_KEY;
    s3Client = builder.s3Client;
  }

  public String bucket() {
    return bucket;
  }

  /**
   * Returns the object key of the state document.
   *
   * @return the key, {@code concordia/state.json} unless configured
   */
  public String key() {
    return key;
  }

  public Region region() {
    return region;
  }

  /**
   * Returns the client supplied by the caller.
   *
   * @return the client, empty when the store must build its own
   */
  public Optional<S3Client> s3Client() {
    return Optional.ofNullable(s3Client);
  }

  /**
   * Starts a configuration. Bucket and region are required.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builds {@link S3StateConfig}. */
  public static final class Builder {

    private String bucket;
    private String key;
    private Region region;
    private S3Client s3Client;

    private Builder() {
    }

    public Builder bucket(final String theBucket) {
      bucket = theBucket;
      return this;
    }

    /**
     * Sets the object key of the state document.
     *
     * @param theKey the key, null or blank for the default
     *
     * @return this builder, never null
     */
    public Builder key(final String theKey) {
      key = theKey;
      return this;
    }

    public Builder region(final Region theRegion) {
      region = theRegion;
      return this;
    }

    /**
     * Shares an existing client. The store will not close it.
     *
     * @param theClient the client, may be null
     *
     * @return this builder, never null
     */
    public Builder s3Client(final S3Client theClient) {
      s3Client = theClient;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws NullPointerException if the bucket or the region is missing
     */
    public S3StateConfig build() {
      return new S3StateConfig(this);
    }
  }
}
