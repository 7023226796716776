package io.github.hide212131.skillpkg.resolver;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a resolution, in installation order.
 *
 * @param requiredBy name of the skill through which this one was reached; empty for the requested root
 */
public record ResolvedDependency(String name, String source, DependencyKind kind, boolean transitive,
        Optional<String> requiredBy) {

    public ResolvedDependency {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(kind, "kind");
        requiredBy = requiredBy == null ? Optional.empty() : requiredBy;
        if (transitive && requiredBy.isEmpty()) {
            throw new IllegalArgumentException("transitive dependency requires requiredBy: " + name);
        }
    }

    public static ResolvedDependency root(String name, String source) {
        return new ResolvedDependency(name, source, DependencyKind.SKILL, false, Optional.empty());
    }

    public static ResolvedDependency transitive(String name, String source, String requiredBy) {
        return new ResolvedDependency(name, source, DependencyKind.SKILL, true, Optional.of(requiredBy));
    }
}
