package io.github.hide212131.skillpkg.resolver;

import java.util.Objects;

/** A declared "dependent needs dependency" relation between two skill names. */
public record DependencyEdge(String dependent, String dependency) {

    public DependencyEdge {
        Objects.requireNonNull(dependent, "dependent");
        Objects.requireNonNull(dependency, "dependency");
    }
}
