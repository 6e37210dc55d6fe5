package org.waabox.concordia.server.config;

import java.net.URI;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.concordia.client.http.circle.CircleConfig;
import org.waabox.concordia.client.http.circle.CircleTargetRegistry;
import org.waabox.concordia.client.http.glueup.GlueUpConfig;
import org.waabox.concordia.client.http.glueup.GlueUpSourceDirectory;
import org.waabox.concordia.state.fs.FileSystemStateStore;
import org.waabox.concordia.state.s3.S3StateConfig;
import org.waabox.concordia.state.s3.S3StateStore;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * Spring configuration that defines the Concordia infrastructure beans
 * for the server.
 *
 * <p>This configuration provides the following beans that are picked up
 * by the concordia-spring-boot-starter auto-configuration:
 * <ul>
 *   <li>{@link GlueUpSourceDirectory}, the directory members and events
 *       are read from</li>
 *   <li>{@link CircleTargetRegistry}, the community they are written
 *       to</li>
 *   <li>a {@link FileSystemStateStore} or, with
 *       {@code concordia.state.type=s3}, an {@link S3StateStore}</li>
 * </ul>
 *
 * <p>Space mapping and event settings are read by the starter from the
 * {@code concordia.*} properties in {@code application.yaml}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
public class ConcordiaServerConfig {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConcordiaServerConfig.class);

  /**
   * Creates the Glue Up directory client.
   *
   * @param baseUrl the API root, never null
   * @param organizationId the organization whose directory is read,
   *        never null
   * @param publicKey the API public key, never null
   * @param privateKey the API private key, never null
   * @param email the account email, never null
   * @param passphrase the account passphrase, never null
   *
   * @return the directory client, never null
   */
  @Bean
  public GlueUpSourceDirectory glueUpSourceDirectory(
      @Value("${glueup.base-url}") final String baseUrl,
      @Value("${glueup.organization-id}") final String organizationId,
      @Value("${glueup.public-key}") final String publicKey,
      @Value("${glueup.private-key}") final String privateKey,
      @Value("${glueup.email}") final String email,
      @Value("${glueup.passphrase}") final String passphrase) {

    return new GlueUpSourceDirectory(GlueUpConfig.builder()
        .baseUrl(baseUrl)
        .organizationId(organizationId)
        .publicKey(publicKey)
        .privateKey(privateKey)
        .email(email)
        .passphrase(passphrase)
        .build());
  }

  /**
   * Creates the Circle community client.
   *
   * @param baseUrl the admin API root, never null
   * @param apiToken the admin API token, never null
   * @param ownerEmail the email of the member owning created events, may
   *        be empty
   *
   * @return the registry client, never null
   */
  @Bean
  public CircleTargetRegistry circleTargetRegistry(
      @Value("${circle.base-url:" + CircleConfig.DEFAULT_BASE_URL + "}")
          final String baseUrl,
      @Value("${circle.api-token}") final String apiToken,
      @Value("${circle.owner-email:}") final String ownerEmail) {

    return new CircleTargetRegistry(CircleConfig.builder()
        .baseUrl(baseUrl)
        .apiToken(apiToken)
        .ownerEmail(ownerEmail)
        .build());
  }

  /**
   * Creates a state store on the local filesystem.
   *
   * @param path the state file, never null
   *
   * @return the state store, never null
   */
  @Bean
  @ConditionalOnProperty(name = "concordia.state.type", havingValue = "fs",
      matchIfMissing = true)
  public FileSystemStateStore fileSystemStateStore(
      @Value("${concordia.state.path:./state/state.json}") final String path) {
    log.info("Keeping state in {}", path);
    return new FileSystemStateStore(Path.of(path));
  }

  /**
   * Creates an S3Client bean managed by Spring so its lifecycle
   * (including close) is handled properly.
   *
   * <p>An endpoint override, for S3-compatible storage such as MinIO,
   * switches to path-style access. Credentials come from the default
   * AWS provider chain.
   *
   * @param region the AWS region, never null
   * @param endpoint the endpoint override, may be empty
   *
   * @return the configured S3 client, never null
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "concordia.state.type", havingValue = "s3")
  S3Client s3Client(
      @Value("${s3.region:us-east-1}") final String region,
      @Value("${s3.endpoint:}") final String endpoint) {

    final S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(region));
    if (!endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
    }
    return builder.build();
  }

  /**
   * Creates an S3-backed state store.
   *
   * @param s3Client the Spring-managed S3 client, never null
   * @param bucket the bucket holding the state, never null
   * @param region the AWS region, never null
   * @param key the object key, never null
   *
   * @return the state store, never null
   */
  @Bean
  @ConditionalOnProperty(name = "concordia.state.type", havingValue = "s3")
  S3StateStore s3StateStore(
      final S3Client s3Client,
      @Value("${s3.bucket}") final String bucket,
      @Value("${s3.region:us-east-1}") final String region,
      @Value("${s3.key:concordia/state.json}") final String key) {
    log.info("Keeping state in s3://{}/{}", bucket, key);
    return new S3StateStore(S3StateConfig.builder()
        .bucket(bucket)
        .region(Region.of(region))
        .key(key)
        .s3Client(s3Client)
        .build());
  }
}
