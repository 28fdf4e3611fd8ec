package dev.scriptorium.version;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Version selection settings.
 *
 * @param selectOnStartup derive the active version from the catalog when the application starts
 * @param initialVersionId version to serve from at startup; when set it is applied as-is and the
 *     catalog is not consulted
 */
@ConfigurationProperties(prefix = "scriptorium.versions")
public record VersionProperties(boolean selectOnStartup, @Nullable String initialVersionId) {

    public boolean hasInitialVersion() {
        return initialVersionId != null && !initialVersionId.isBlank();
    }
}
