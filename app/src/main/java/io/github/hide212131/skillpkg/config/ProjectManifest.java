package io.github.hide212131.skillpkg.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** skillpkg.json の内容。{@code skills} はスキル名から取得元への対応。 */
public record ProjectManifest(String name, Optional<String> version, Map<String, String> skills) {

    public ProjectManifest {
        Objects.requireNonNull(name, "name");
        version = version == null ? Optional.empty() : version;
        skills = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(skills, "skills")));
    }

    public boolean declares(String skillName) {
        return skills.containsKey(skillName);
    }
}
