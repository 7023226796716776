package io.github.hide212131.skillpkg.installer;

import java.util.Objects;
import java.util.Optional;

/** Outcome for one skill of an install run. */
public record SkillInstallResult(String name, String version, SkillInstallAction action, boolean transitive,
        Optional<String> requiredBy, Optional<String> error) {

    public SkillInstallResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(action, "action");
        requiredBy = requiredBy == null ? Optional.empty() : requiredBy;
        error = error == null ? Optional.empty() : error;
    }

    public boolean success() {
        return action != SkillInstallAction.FAILED;
    }
}
