package io.github.hide212131.skillpkg.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a {@link ResolutionResult} into an {@link InstallPlan}. Pure and synchronous; step order is the
 * resolver's order, so every dependency is planned before the skills that need it.
 */
public final class InstallPlanner {

    public InstallPlan plan(ResolutionResult resolution, Set<String> alreadyInstalled) {
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(alreadyInstalled, "alreadyInstalled");
        if (resolution.isCircular()) {
            return new InstallPlan(List.of(), List.of(), true, resolution.errors(), resolution.circularChain());
        }
        List<InstallStep> steps = new ArrayList<>();
        for (ResolvedDependency dependency : resolution.dependencies()) {
            if (alreadyInstalled.contains(dependency.name())) {
                steps.add(InstallStep.skip(dependency, InstallStep.ALREADY_INSTALLED));
            } else {
                steps.add(InstallStep.install(dependency));
            }
        }
        List<ExternalToolRequirement> tools = new ArrayList<>();
        for (String tool : resolution.toolsToInstall()) {
            tools.add(new ExternalToolRequirement(tool, resolution.toolRequirers().getOrDefault(tool, List.of())));
        }
        return new InstallPlan(steps, tools, resolution.hasErrors(), resolution.errors(), Optional.empty());
    }

    /** Human-readable rendering; carries no decisions of its own. */
    public String format(InstallPlan plan) {
        Objects.requireNonNull(plan, "plan");
        if (plan.circularChain().isPresent()) {
            return "Circular dependency detected: " + String.join(" → ", plan.circularChain().get());
        }
        List<String> lines = new ArrayList<>();
        List<InstallStep> toInstall = plan.stepsToInstall();
        if (!toInstall.isEmpty()) {
            lines.add("Skills to install:");
            for (InstallStep step : toInstall) {
                String suffix = step.transitive()
                        ? step.requiredBy().map(parent -> " (required by " + parent + ")").orElse("")
                        : "";
                lines.add("  + " + step.name() + suffix);
            }
        }
        List<InstallStep> skipped = plan.skippedSteps();
        if (!skipped.isEmpty()) {
            lines.add("Skills already installed:");
            skipped.forEach(step -> lines.add("  = " + step.name()));
        }
        if (plan.hasToolRequirements()) {
            lines.add("External tools required:");
            plan.toolRequirements().forEach(tool -> lines.add("  ! " + tool.name()));
        }
        if (!plan.errors().isEmpty()) {
            lines.add("Errors:");
            plan.errors().forEach(error -> lines.add("  - " + error));
        }
        return String.join("\n", lines);
    }
}
