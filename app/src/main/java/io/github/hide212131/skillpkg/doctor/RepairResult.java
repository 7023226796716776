package io.github.hide212131.skillpkg.doctor;

import java.util.List;

public record RepairResult(boolean success, List<RepairAction> actions, List<String> errors, int issuesFixed,
        int issuesRemaining) {

    public RepairResult {
        actions = List.copyOf(actions);
        errors = List.copyOf(errors);
    }
}
