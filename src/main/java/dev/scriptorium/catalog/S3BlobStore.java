package dev.scriptorium.catalog;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * {@link BlobStore} backed by one bucket of an S3-compatible object store.
 *
 * <p>Listing follows continuation tokens until the store reports no more pages.
 */
public class S3BlobStore implements BlobStore {

  private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

  private final S3Client s3Client;
  private final String bucket;

  public S3BlobStore(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  @Override
  public List<BlobObject> list(String prefix) {
    List<BlobObject> objects = new ArrayList<>();
    @Nullable String continuationToken = null;
    try {
      do {
        ListObjectsV2Request.Builder request =
            ListObjectsV2Request.builder().bucket(bucket).prefix(prefix);
        if (continuationToken != null) {
          request.continuationToken(continuationToken);
        }
        ListObjectsV2Response response = s3Client.listObjectsV2(request.build());
        for (S3Object object : response.contents()) {
          objects.add(new BlobObject(object.key(), object.lastModified()));
        }
        continuationToken =
            Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      } while (continuationToken != null);
    } catch (SdkException e) {
      throw new BlobStoreException(
          "Listing s3://%s/%s failed: %s".formatted(bucket, prefix, e.getMessage()), e);
    }
    log.debug("Listed {} objects under s3://{}/{}", objects.size(), bucket, prefix);
    return objects;
  }

  @Override
  public byte[] get(String key) {
    try {
      return s3Client
          .getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
          .asByteArray();
    } catch (SdkException e) {
      throw new BlobStoreException(
          "Reading s3://%s/%s failed: %s".formatted(bucket, key, e.getMessage()), e);
    }
  }
}
