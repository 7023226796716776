package io.github.hide212131.skillpkg.installer;

import io.github.hide212131.skillpkg.resolver.SkillFetcher;
import java.util.Optional;

/** A {@link SkillFetcher} that can also hand over the skill's files for installation. */
public interface SkillContentFetcher extends SkillFetcher {

    /** Empty when the source does not exist. */
    Optional<FetchedSkill> fetchSkill(String source);
}
