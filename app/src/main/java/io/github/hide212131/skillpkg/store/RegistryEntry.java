package io.github.hide212131.skillpkg.store;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** registry.json の 1 スキル分のメタデータ。 */
public record RegistryEntry(String name, String version, Instant installedAt, RegistrySource source,
        Optional<String> sourceUrl, List<String> syncedPlatforms, Optional<Instant> lastSynced) {

    public RegistryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(installedAt, "installedAt");
        Objects.requireNonNull(source, "source");
        sourceUrl = sourceUrl == null ? Optional.empty() : sourceUrl;
        syncedPlatforms = syncedPlatforms == null ? List.of() : List.copyOf(syncedPlatforms);
        lastSynced = lastSynced == null ? Optional.empty() : lastSynced;
    }

    public static RegistryEntry of(String name, String version, Instant installedAt, RegistrySource source,
            Optional<String> sourceUrl) {
        return new RegistryEntry(name, version, installedAt, source, sourceUrl, List.of(), Optional.empty());
    }

    public boolean isSynced() {
        return !syncedPlatforms.isEmpty();
    }
}
