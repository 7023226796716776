package io.github.hide212131.skillpkg.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link DependencyResolver#resolve}.
 *
 * @param dependencies  skills in topological order, dependencies before dependents
 * @param toolsToInstall external tools, de-duplicated by exact name
 * @param toolRequirers  tool name to the skills that declared it
 * @param edges          every dependent/dependency relation traversed, including pruned ones
 * @param circularChain  present when resolution was aborted by a cycle
 */
public record ResolutionResult(List<ResolvedDependency> dependencies, List<String> toolsToInstall,
        Map<String, List<String>> toolRequirers, List<DependencyEdge> edges, List<String> errors,
        Optional<List<String>> circularChain) {

    public ResolutionResult {
        dependencies = List.copyOf(Objects.requireNonNull(dependencies, "dependencies"));
        toolsToInstall = List.copyOf(Objects.requireNonNull(toolsToInstall, "toolsToInstall"));
        Map<String, List<String>> requirers = new LinkedHashMap<>();
        Objects.requireNonNull(toolRequirers, "toolRequirers")
                .forEach((tool, skills) -> requirers.put(tool, List.copyOf(skills)));
        toolRequirers = Collections.unmodifiableMap(requirers);
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
        circularChain = circularChain == null ? Optional.empty() : circularChain.map(List::copyOf);
    }

    public static ResolutionResult circular(List<String> chain, List<String> errors) {
        return new ResolutionResult(List.of(), List.of(), Map.of(), List.of(), errors, Optional.of(chain));
    }

    public static ResolutionResult failed(List<String> errors) {
        return new ResolutionResult(List.of(), List.of(), Map.of(), List.of(), errors, Optional.empty());
    }

    public boolean isCircular() {
        return circularChain.isPresent();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
