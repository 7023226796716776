package io.github.hide212131.skillpkg.resolver;

import java.util.List;

/** Raised inside the resolver when a skill is reached again while it is still on the traversal stack. */
public class CircularDependencyException extends RuntimeException {

    private final List<String> chain;

    public CircularDependencyException(List<String> chain) {
        super("Circular dependency detected: " + String.join(" → ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
