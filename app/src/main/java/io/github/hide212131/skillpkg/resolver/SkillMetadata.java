package io.github.hide212131.skillpkg.resolver;

import java.util.List;
import java.util.Objects;

/**
 * Minimal metadata a fetcher returns for dependency resolution.
 *
 * @param name    name declared by the skill itself
 * @param version declared version
 * @param skills  sources of the skills this skill depends on
 * @param tools   names of external tools (e.g. MCP servers) this skill needs
 */
public record SkillMetadata(String name, String version, List<String> skills, List<String> tools) {

    public SkillMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        skills = skills == null ? List.of() : List.copyOf(skills);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static SkillMetadata of(String name, String version) {
        return new SkillMetadata(name, version, List.of(), List.of());
    }
}
