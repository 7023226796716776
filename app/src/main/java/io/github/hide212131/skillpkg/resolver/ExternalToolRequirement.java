package io.github.hide212131.skillpkg.resolver;

import java.util.List;
import java.util.Objects;

/** An external tool a plan needs. Tools are only reported, never installed. */
public record ExternalToolRequirement(String name, List<String> requiredBy) {

    public ExternalToolRequirement {
        Objects.requireNonNull(name, "name");
        requiredBy = requiredBy == null ? List.of() : List.copyOf(requiredBy);
    }
}
