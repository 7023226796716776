package io.github.hide212131.skillpkg.state;

import java.util.List;

/** Answer of the uninstall safety gate. {@code ok} is true iff no installed skill depends on the target. */
public record UninstallCheck(boolean ok, List<String> dependents) {

    public UninstallCheck {
        dependents = dependents == null ? List.of() : List.copyOf(dependents);
    }
}
