package io.github.hide212131.skillpkg.resolver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Ordered install/skip steps produced by {@link InstallPlanner}. */
public record InstallPlan(List<InstallStep> steps, List<ExternalToolRequirement> toolRequirements,
        boolean hasErrors, List<String> errors, Optional<List<String>> circularChain) {

    public InstallPlan {
        steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
        toolRequirements = List.copyOf(Objects.requireNonNull(toolRequirements, "toolRequirements"));
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
        circularChain = circularChain == null ? Optional.empty() : circularChain.map(List::copyOf);
    }

    public List<InstallStep> stepsToInstall() {
        return steps.stream().filter(InstallStep::isInstall).toList();
    }

    public List<InstallStep> skippedSteps() {
        return steps.stream().filter(step -> !step.isInstall()).toList();
    }

    public int installCount() {
        return stepsToInstall().size();
    }

    public boolean hasToolRequirements() {
        return !toolRequirements.isEmpty();
    }
}
