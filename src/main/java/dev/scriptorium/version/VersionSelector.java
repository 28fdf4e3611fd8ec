package dev.scriptorium.version;

import dev.scriptorium.catalog.ArtifactCatalogReader;
import dev.scriptorium.catalog.IndexVersion;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chooses which index version serves live traffic and moves the {@link ActiveVersionPointer}.
 *
 * <p>Selection picks the READY version with the latest {@code createdAt}; ties go to the
 * lexicographically greatest {@code versionId} so the choice is deterministic. Finding no READY
 * version is a normal outcome (first setup, build still running) and is reported as an empty
 * {@link Optional}, never as an exception.
 */
@Service
public class VersionSelector {

  private static final Logger log = LoggerFactory.getLogger(VersionSelector.class);

  static final Comparator<IndexVersion> RECENCY =
      Comparator.comparing(IndexVersion::createdAt).thenComparing(IndexVersion::versionId);

  private final ArtifactCatalogReader catalogReader;
  private final ActiveVersionPointer pointer;

  public VersionSelector(ArtifactCatalogReader catalogReader, ActiveVersionPointer pointer) {
    this.catalogReader = catalogReader;
    this.pointer = pointer;
  }

  /**
   * Picks the latest READY version.
   *
   * @param versions catalog entries in any order
   * @return the latest READY version, or empty if there is none
   */
  public Optional<IndexVersion> selectLatestReady(List<IndexVersion> versions) {
    return versions.stream().filter(IndexVersion::isReady).max(RECENCY);
  }

  /**
   * Points query traffic at {@code versionId}.
   *
   * <p>The caller must have just confirmed the version is READY; this method does not re-check.
   * Applying the currently active id again is a no-op with the same observable state.
   *
   * @param versionId the version to activate
   * @return the previous and the new active id
   */
  public VersionSwitch apply(String versionId) {
    if (versionId == null || versionId.isBlank()) {
      throw new IllegalArgumentException("versionId must not be blank");
    }
    String applied = versionId.trim();
    VersionSwitch change = new VersionSwitch(pointer.set(applied), applied);
    if (change.unchanged()) {
      log.debug("Active index version already {}", applied);
    } else {
      log.info("Active index version: {} -> {}", change.previousVersionId(), applied);
    }
    return change;
  }

  /**
   * Reads the catalog and activates the latest READY version, if any.
   *
   * @return the applied switch, or empty if no READY version exists
   * @throws dev.scriptorium.catalog.CatalogUnavailableException if the catalog cannot be listed
   */
  public Optional<VersionSwitch> applyLatestReady() {
    Optional<IndexVersion> latest = selectLatestReady(catalogReader.listVersions());
    if (latest.isEmpty()) {
      log.info("No READY index version found; active version left at {}", pointer.get().orElse("none"));
      return Optional.empty();
    }
    return Optional.of(apply(latest.get().versionId()));
  }

  /**
   * Activates a specific version after confirming against the catalog that it is READY.
   *
   * @param versionId the version to activate
   * @return the applied switch
   * @throws VersionNotReadyException if the version is missing or not READY
   * @throws dev.scriptorium.catalog.CatalogUnavailableException if the catalog cannot be listed
   */
  public VersionSwitch applyIfReady(String versionId) {
    if (versionId == null || versionId.isBlank()) {
      throw new IllegalArgumentException("versionId must not be blank");
    }
    String wanted = versionId.trim();
    Optional<IndexVersion> listed =
        catalogReader.listVersions().stream()
            .filter(v -> v.versionId().equals(wanted))
            .findFirst();
    if (listed.isEmpty()) {
      throw new VersionNotReadyException(wanted, null);
    }
    if (!listed.get().isReady()) {
      throw new VersionNotReadyException(wanted, listed.get().status());
    }
    return apply(wanted);
  }
}
