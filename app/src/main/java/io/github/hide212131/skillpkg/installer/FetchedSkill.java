package io.github.hide212131.skillpkg.installer;

import io.github.hide212131.skillpkg.resolver.SkillMetadata;
import io.github.hide212131.skillpkg.store.RegistrySource;
import java.nio.file.Path;
import java.util.Objects;

/**
 * @param contentDir directory whose contents become {@code .skillpkg/skills/<name>/}
 */
public record FetchedSkill(SkillMetadata metadata, Path contentDir, RegistrySource origin) {

    public FetchedSkill {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(contentDir, "contentDir");
        Objects.requireNonNull(origin, "origin");
    }
}
