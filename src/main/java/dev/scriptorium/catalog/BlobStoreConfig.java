package dev.scriptorium.catalog;

import java.net.URI;
import java.time.Duration;

import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the S3 client used to read the version catalog.
 *
 * <p>Path-style addressing and the custom endpoint are required by the S3-compatible store the
 * search backend writes its artifacts to.
 */
@Configuration
public class BlobStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(BlobStoreConfig.class);

    @Bean(destroyMethod = "close")
    public S3Client catalogS3Client(BlobStoreProperties properties) {
        return S3Client.builder()
                .endpointOverride(URI.create(properties.endpoint()))
                .region(Region.of(properties.region()))
                .credentialsProvider(credentialsProvider(properties))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(properties.pathStyleAccess())
                        .build())
                .overrideConfiguration(c -> c.apiCallTimeout(
                        Duration.ofMillis(properties.apiCallTimeoutMs())))
                .build();
    }

    private static AwsCredentialsProvider credentialsProvider(BlobStoreProperties properties) {
        if (properties.keyId() == null || properties.keyId().isBlank()
                || properties.secret() == null || properties.secret().isBlank()) {
            log.warn("Blob store credentials are not configured; catalog listing will be anonymous");
            return AnonymousCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(properties.accessKeyId(), properties.secret()));
    }

    @Bean
    public BlobStore catalogBlobStore(S3Client catalogS3Client, CatalogProperties catalog) {
        return new S3BlobStore(catalogS3Client, catalog.bucket());
    }
}
