package dev.scriptorium.catalog;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the S3-compatible blob store.
 *
 * <p>When {@code tenantId} is set, the access key id sent to the store is {@code tenantId:keyId}.
 */
@ConfigurationProperties(prefix = "scriptorium.blob-store")
public record BlobStoreProperties(
        String endpoint,
        String region,
        @Nullable String tenantId,
        @Nullable String keyId,
        @Nullable String secret,
        boolean pathStyleAccess,
        int apiCallTimeoutMs
) {

    public String accessKeyId() {
        String id = keyId == null ? "" : keyId;
        return tenantId == null || tenantId.isBlank() ? id : tenantId + ":" + id;
    }
}
