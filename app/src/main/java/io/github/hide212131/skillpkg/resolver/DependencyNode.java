package io.github.hide212131.skillpkg.resolver;

import java.util.List;
import java.util.Objects;

/** Display tree built by {@link DependencyResolver#buildDependencyTree}. */
public record DependencyNode(String name, String version, String source, List<DependencyNode> dependencies,
        List<String> tools) {

    public DependencyNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(source, "source");
        dependencies = List.copyOf(Objects.requireNonNull(dependencies, "dependencies"));
        tools = List.copyOf(Objects.requireNonNull(tools, "tools"));
    }
}
