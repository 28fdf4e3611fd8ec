package dev.scriptorium.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads the version catalog the search backend maintains in the blob store.
 *
 * <p>Each version owns a folder directly under {@link CatalogProperties#prefix()}. A folder may hold
 * a metadata object named {@link CatalogProperties#metadataFileName()}; its version id defaults to
 * the folder name and its creation time to the object's last-modified time. Folders written
 * without metadata are listed from their contents or skipped, per {@link
 * CatalogProperties#deriveFromFolders()}.
 *
 * <p>Folders that cannot be read or parsed are skipped and counted; only a failed listing aborts
 * the read. The catalog is eventually consistent with job submission: a freshly submitted run may
 * not be listed yet.
 */
@Service
public class ArtifactCatalogReader {

  private static final Logger log = LoggerFactory.getLogger(ArtifactCatalogReader.class);

  static final Comparator<IndexVersion> LISTING_ORDER =
      Comparator.comparing(IndexVersion::createdAt).thenComparing(IndexVersion::versionId);

  private final BlobStore blobStore;
  private final CatalogProperties properties;
  private final ObjectMapper objectMapper;

  public ArtifactCatalogReader(
      BlobStore blobStore, CatalogProperties properties, ObjectMapper objectMapper) {
    this.blobStore = blobStore;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Lists all parseable versions ordered by creation time ascending.
   *
   * @return the versions, possibly empty
   * @throws CatalogUnavailableException if the blob store listing fails
   */
  public List<IndexVersion> listVersions() {
    return readCatalog().versions();
  }

  /**
   * Reads the catalog, returning the parsed versions together with the number of skipped entries.
   *
   * <p>Listed keys are grouped by the version folder directly under the prefix. A folder holding a
   * metadata object is described by that object. A folder without one is derived from its contents
   * when {@link CatalogProperties#deriveFromFolders()} is set, and skipped otherwise.
   *
   * @return a snapshot of the catalog
   * @throws CatalogUnavailableException if the blob store listing fails
   */
  public CatalogSnapshot readCatalog() {
    List<BlobObject> objects;
    try {
      objects = blobStore.list(properties.prefix());
    } catch (BlobStoreException e) {
      throw new CatalogUnavailableException(
          "Version catalog listing failed: " + e.getMessage(), e);
    }

    Map<String, List<BlobObject>> folders = new LinkedHashMap<>();
    for (BlobObject object : objects) {
      String folder = folderName(object.key());
      if (folder != null) {
        folders.computeIfAbsent(folder, f -> new ArrayList<>()).add(object);
      }
    }

    List<IndexVersion> versions = new ArrayList<>();
    int skipped = 0;
    for (Map.Entry<String, List<BlobObject>> folder : folders.entrySet()) {
      Optional<BlobObject> metadata =
          folder.getValue().stream()
              .filter(o -> isMetadataObject(folder.getKey(), o.key()))
              .findFirst();
      try {
        if (metadata.isPresent()) {
          versions.add(parse(metadata.get()));
        } else if (properties.deriveFromFolders()) {
          versions.add(fromFolder(folder.getKey(), folder.getValue()));
        } else {
          skipped++;
          log.warn(
              "Skipping catalog folder {}: no {} object",
              folder.getKey(),
              properties.metadataFileName());
        }
      } catch (RuntimeException | IOException e) {
        skipped++;
        log.warn("Skipping catalog folder {}: {}", folder.getKey(), e.getMessage());
      }
    }

    versions.sort(LISTING_ORDER);
    if (skipped > 0) {
      log.info("Catalog read: {} versions, {} entries skipped", versions.size(), skipped);
    }
    return new CatalogSnapshot(versions, skipped);
  }

  private boolean isMetadataObject(String folder, String key) {
    return key.equals(properties.prefix() + folder + "/" + properties.metadataFileName());
  }

  IndexVersion parse(BlobObject object) throws IOException {
    VersionMetadataDocument document =
        objectMapper.readValue(blobStore.get(object.key()), VersionMetadataDocument.class);
    if (document == null) {
      throw new IllegalArgumentException("metadata document is empty");
    }

    String versionId = hasText(document.versionId()) ? document.versionId() : folderName(object.key());
    if (versionId == null) {
      throw new IllegalArgumentException("no version id in document or key");
    }

    return new IndexVersion(
        versionId.trim(),
        VersionStatus.parse(document.status()),
        parseInstant(document.createdAt(), object.lastModified()),
        document.sourcePrefix());
  }

  /** A folder holding artifacts but no metadata object is a finished build. */
  private static IndexVersion fromFolder(String folder, List<BlobObject> objects) {
    Instant newest =
        objects.stream().map(BlobObject::lastModified).max(Comparator.naturalOrder()).orElseThrow();
    return new IndexVersion(folder, VersionStatus.READY, newest, null);
  }

  /** Returns the version folder directly under the prefix that contains {@code key}, if any. */
  @Nullable String folderName(String key) {
    if (!key.startsWith(properties.prefix())) {
      return null;
    }
    String relative = key.substring(properties.prefix().length());
    int slash = relative.indexOf('/');
    if (slash <= 0) {
      return null;
    }
    return relative.substring(0, slash);
  }

  private static Instant parseInstant(@Nullable String value, Instant fallback) {
    if (!hasText(value)) {
      return fallback;
    }
    try {
      return OffsetDateTime.parse(value.trim()).toInstant();
    } catch (DateTimeParseException e) {
      return Instant.parse(value.trim());
    }
  }

  private static boolean hasText(@Nullable String value) {
    return value != null && !value.isBlank();
  }
}
