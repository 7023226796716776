package io.github.hide212131.skillpkg.installer;

import java.util.List;

/**
 * @param dependents installed skills that blocked the removal; empty unless it was rejected
 */
public record UninstallResult(boolean success, List<String> removed, List<String> orphansRemoved,
        List<String> dependents, List<String> errors) {

    public UninstallResult {
        removed = List.copyOf(removed);
        orphansRemoved = List.copyOf(orphansRemoved);
        dependents = List.copyOf(dependents);
        errors = List.copyOf(errors);
    }

    static UninstallResult failure(String error, List<String> dependents) {
        return new UninstallResult(false, List.of(), List.of(), dependents, List.of(error));
    }
}
