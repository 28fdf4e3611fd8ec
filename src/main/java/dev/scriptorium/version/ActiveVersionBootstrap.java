package dev.scriptorium.version;

import dev.scriptorium.catalog.CatalogUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Re-derives the active version from the catalog at startup.
 *
 * <p>The pointer is not persisted, so a restarted process would otherwise reject every query until
 * someone ran selection. A configured initial version takes precedence and is applied without
 * reading the catalog. Otherwise the latest READY version is selected; a catalog outage at startup
 * is logged and leaves the pointer unset, and the application still starts.
 */
@Component
public class ActiveVersionBootstrap implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(ActiveVersionBootstrap.class);

  private final VersionSelector versionSelector;
  private final VersionProperties properties;

  public ActiveVersionBootstrap(VersionSelector versionSelector, VersionProperties properties) {
    this.versionSelector = versionSelector;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (properties.hasInitialVersion()) {
      VersionSwitch change = versionSelector.apply(properties.initialVersionId());
      log.info("Serving configured index version {}", change.appliedVersionId());
      return;
    }
    if (!properties.selectOnStartup()) {
      log.info("Startup version selection disabled; waiting for update_active_version");
      return;
    }
    try {
      versionSelector
          .applyLatestReady()
          .ifPresent(change -> log.info("Serving index version {}", change.appliedVersionId()));
    } catch (CatalogUnavailableException e) {
      log.warn("Could not select an index version at startup: {}", e.getMessage());
    }
  }
}
