package io.github.hide212131.skillpkg.resolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Test fetcher backed by a map of source to metadata. */
final class InMemorySkillFetcher implements SkillFetcher {

    private final Map<String, SkillMetadata> skills = new HashMap<>();
    private final Set<String> broken = new HashSet<>();
    private final List<String> requests = new ArrayList<>();

    InMemorySkillFetcher skill(String name, List<String> dependencies, List<String> tools) {
        skills.put(name, new SkillMetadata(name, "1.0.0", dependencies, tools));
        return this;
    }

    InMemorySkillFetcher skill(String name, String... dependencies) {
        return skill(name, List.of(dependencies), List.of());
    }

    InMemorySkillFetcher broken(String source) {
        broken.add(source);
        return this;
    }

    List<String> requests() {
        return requests;
    }

    @Override
    public Optional<SkillMetadata> fetchMetadata(String source) {
        requests.add(source);
        if (broken.contains(source)) {
            throw new SkillFetchException("connection reset: " + source);
        }
        return Optional.ofNullable(skills.get(source));
    }
}
