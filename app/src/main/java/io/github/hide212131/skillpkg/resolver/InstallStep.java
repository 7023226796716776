package io.github.hide212131.skillpkg.resolver;

import java.util.Objects;
import java.util.Optional;

/**
 * A resolved dependency together with the action the installer takes for it.
 *
 * @param skipReason set only when {@code action} is {@link InstallAction#SKIP}
 */
public record InstallStep(ResolvedDependency dependency, InstallAction action, Optional<String> skipReason) {

    public static final String ALREADY_INSTALLED = "already installed";

    public InstallStep {
        Objects.requireNonNull(dependency, "dependency");
        Objects.requireNonNull(action, "action");
        skipReason = skipReason == null ? Optional.empty() : skipReason;
    }

    public static InstallStep install(ResolvedDependency dependency) {
        return new InstallStep(dependency, InstallAction.INSTALL, Optional.empty());
    }

    public static InstallStep skip(ResolvedDependency dependency, String reason) {
        return new InstallStep(dependency, InstallAction.SKIP, Optional.of(reason));
    }

    public String name() {
        return dependency.name();
    }

    public String source() {
        return dependency.source();
    }

    public boolean transitive() {
        return dependency.transitive();
    }

    public Optional<String> requiredBy() {
        return dependency.requiredBy();
    }

    public boolean isInstall() {
        return action == InstallAction.INSTALL;
    }
}
