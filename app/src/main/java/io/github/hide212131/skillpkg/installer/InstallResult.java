package io.github.hide212131.skillpkg.installer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * @param toolsRequired external tools the installed skills declare; never installed automatically
 */
public record InstallResult(boolean success, List<SkillInstallResult> skills, List<String> toolsRequired,
        List<String> errors, InstallStats stats) {

    public InstallResult {
        skills = List.copyOf(skills);
        toolsRequired = List.copyOf(toolsRequired);
        errors = List.copyOf(errors);
    }

    static InstallResult of(List<SkillInstallResult> skills, List<String> toolsRequired, List<String> errors) {
        boolean failed = !errors.isEmpty() && skills.isEmpty()
                || skills.stream().anyMatch(skill -> !skill.success());
        return new InstallResult(!failed, skills, toolsRequired, errors, InstallStats.of(skills));
    }

    static InstallResult failure(List<String> errors) {
        return new InstallResult(false, List.of(), List.of(), errors, new InstallStats(0, 0, 0, 0));
    }

    /** Combines the results of several installs, as done for a manifest. */
    static InstallResult merge(List<InstallResult> results) {
        List<SkillInstallResult> skills = new ArrayList<>();
        LinkedHashSet<String> tools = new LinkedHashSet<>();
        List<String> errors = new ArrayList<>();
        boolean success = true;
        for (InstallResult result : results) {
            skills.addAll(result.skills());
            tools.addAll(result.toolsRequired());
            errors.addAll(result.errors());
            success &= result.success();
        }
        return new InstallResult(success, skills, new ArrayList<>(tools), errors, InstallStats.of(skills));
    }
}
