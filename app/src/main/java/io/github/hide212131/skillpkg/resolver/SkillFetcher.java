package io.github.hide212131.skillpkg.resolver;

import java.util.Optional;

/** Looks up skill metadata for a source locator. */
@FunctionalInterface
public interface SkillFetcher {

    /**
     * @return the metadata, or empty when nothing exists at {@code source}
     * @throws SkillFetchException when the source could not be reached at all
     */
    Optional<SkillMetadata> fetchMetadata(String source);
}
