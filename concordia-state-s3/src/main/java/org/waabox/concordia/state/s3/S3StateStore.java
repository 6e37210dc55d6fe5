package org.waabox.concordia.state.s3;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.state.StateStore;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Keeps the state document as one S3 object so several stateless
 * instances can share it.
 *
 * <p>Readers see either the previous or the new document. Writers are not
 * coordinated; the last put wins. A client built here from the region is
 * closed by {@link #close()}, a shared one is not.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3StateStore implements StateStore, AutoCloseable {

  private static final Logger log =
      LoggerFactory.getLogger(S3StateStore.class);

  private static final String CONTENT_TYPE = "application/json";

  private final String bucket;
  private final String key;
  private final S3Client s3Client;

  /** True when the client was built here and must be closed here. */
  private final boolean ownsClient;

  /**
   * Creates the store.
   *
   * @param config where the document lives, never null
   */
  public S3StateStore(final S3StateConfig config) {
    Objects.requireNonNull(config, "config must not be null");

    bucket = config.bucket();
    key = config.key();

    if (config.s3Client().isPresent()) {
      s3Client = config.s3Client().get();
      ownsClient = false;
    } else {
      s3Client = S3Client.builder()
          .region(config.region())
          .build();
      ownsClient = true;
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>A missing object reads as empty.
   *
   * @throws UncheckedIOException if the object body can not be read
   */
  @Override
  public Optional<byte[]> read() {
    log.debug("Loading state from s3://{}/{}", bucket, key);

    final GetObjectRequest request = GetObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .build();

    try (ResponseInputStream<GetObjectResponse> response =
             s3Client.getObject(request)) {
      final byte[] document = response.readAllBytes();
      log.info("Loaded state ({} bytes) from s3://{}/{}", document.length,
          bucket, key);
      return Optional.of(document);

    } catch (final NoSuchKeyException e) {
      log.info("No state found at s3://{}/{}", bucket, key);
      return Optional.empty();

    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to read state from s3://" + bucket + "/" + key, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void write(final byte[] document) {
    Objects.requireNonNull(document, "document must not be null");

    final PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(CONTENT_TYPE)
        .build();

    s3Client.putObject(request, RequestBody.fromBytes(document));

    log.debug("Saved state ({} bytes) to s3://{}/{}", document.length,
        bucket, key);
  }

  /** Releases the client, unless it was shared through the config. */
  @Override
  public void close() {
    if (ownsClient) {
      log.debug("Closing S3 client owned by this store");
      s3Client.close();
    }
  }
}
