package io.github.hide212131.skillpkg.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** スキルストア自身のメタデータ（registry.json）。更新系メソッドは新しいインスタンスを返す。 */
public record Registry(String version, Map<String, RegistryEntry> skills, Instant lastUpdated) {

    public static final String FORMAT_VERSION = "1.0";

    public Registry {
        Objects.requireNonNull(version, "version");
        skills = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(skills, "skills")));
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public static Registry empty(Instant now) {
        return new Registry(FORMAT_VERSION, Map.of(), now);
    }

    public Optional<RegistryEntry> entry(String name) {
        return Optional.ofNullable(skills.get(name));
    }

    public boolean contains(String name) {
        return skills.containsKey(name);
    }

    public Registry with(RegistryEntry entry, Instant now) {
        Map<String, RegistryEntry> updated = new LinkedHashMap<>(skills);
        updated.put(entry.name(), entry);
        return new Registry(version, updated, now);
    }

    public Registry without(String name, Instant now) {
        Map<String, RegistryEntry> updated = new LinkedHashMap<>(skills);
        updated.remove(name);
        return new Registry(version, updated, now);
    }
}
