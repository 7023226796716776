package io.github.hide212131.skillpkg.installer;

import io.github.hide212131.skillpkg.config.ManifestStore;
import io.github.hide212131.skillpkg.config.ProjectManifest;
import io.github.hide212131.skillpkg.resolver.DependencyEdge;
import io.github.hide212131.skillpkg.resolver.DependencyResolver;
import io.github.hide212131.skillpkg.resolver.ExternalToolRequirement;
import io.github.hide212131.skillpkg.resolver.InstallPlan;
import io.github.hide212131.skillpkg.resolver.InstallPlanner;
import io.github.hide212131.skillpkg.resolver.InstallStep;
import io.github.hide212131.skillpkg.resolver.ResolutionResult;
import io.github.hide212131.skillpkg.resolver.ResolvedDependency;
import io.github.hide212131.skillpkg.resolver.SkillMetadata;
import io.github.hide212131.skillpkg.resolver.SkillNames;
import io.github.hide212131.skillpkg.state.InstalledBy;
import io.github.hide212131.skillpkg.state.SkillLedgerEntry;
import io.github.hide212131.skillpkg.state.StateLedger;
import io.github.hide212131.skillpkg.state.UninstallCheck;
import io.github.hide212131.skillpkg.store.SkillStore;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs and removes skills with their dependencies: resolve, plan, then apply each step to the store, the
 * ledger and the manifest in plan order.
 */
public final class Installer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Installer.class);

    private final StateLedger ledger;
    private final SkillStore store;
    private final ManifestStore manifests;
    private final SkillContentFetcher fetcher;
    private final DependencyResolver resolver;
    private final InstallPlanner planner = new InstallPlanner();

    public Installer(StateLedger ledger, SkillStore store, ManifestStore manifests, SkillContentFetcher fetcher) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.store = Objects.requireNonNull(store, "store");
        this.manifests = Objects.requireNonNull(manifests, "manifests");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.resolver = new DependencyResolver(fetcher);
    }

    public DependencyResolver resolver() {
        return resolver;
    }

    /** Plans the install of {@code source} against what the project already has. Writes nothing. */
    public InstallPlan plan(Path project, String source) {
        ResolutionResult resolution = resolver.resolve(source, Set.of());
        return planner.plan(resolution, ledger.installedSkillNames(project));
    }

    public InstallResult install(Path project, String source, InstallOptions options) {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
        try {
            ResolutionResult resolution;
            if (options.skipDependencies()) {
                Optional<ResolutionResult> single = singleSkill(source);
                if (single.isEmpty()) {
                    return InstallResult.failure(List.of("Failed to fetch skill metadata from: " + source));
                }
                resolution = single.get();
            } else {
                resolution = resolver.resolve(source, Set.of());
            }
            if (resolution.isCircular()) {
                return InstallResult.failure(resolution.errors());
            }
            if (resolution.hasErrors() && resolution.dependencies().isEmpty()) {
                return InstallResult.failure(resolution.errors());
            }

            Set<String> installed = options.force() ? Set.of() : ledger.installedSkillNames(project);
            InstallPlan plan = planner.plan(resolution, installed);
            List<String> tools = plan.toolRequirements().stream().map(ExternalToolRequirement::name).toList();
            List<String> errors = new ArrayList<>(plan.errors());

            if (options.dryRun()) {
                List<SkillInstallResult> skills = new ArrayList<>();
                for (InstallStep step : plan.steps()) {
                    skills.add(new SkillInstallResult(step.name(), "?",
                            step.isInstall() ? SkillInstallAction.INSTALLED : SkillInstallAction.SKIPPED,
                            step.transitive(), step.requiredBy(), Optional.empty()));
                }
                return InstallResult.of(skills, tools, errors);
            }

            List<SkillInstallResult> skills = new ArrayList<>();
            for (InstallStep step : plan.stepsToInstall()) {
                SkillInstallResult result = installStep(project, step);
                result.error().ifPresent(errors::add);
                skills.add(result);
            }
            Map<String, SkillLedgerEntry> current = ledger.load(project).skills();
            for (InstallStep step : plan.skippedSteps()) {
                String version = Optional.ofNullable(current.get(step.name()))
                        .map(SkillLedgerEntry::version)
                        .orElse("unknown");
                skills.add(new SkillInstallResult(step.name(), version, SkillInstallAction.SKIPPED,
                        step.transitive(), step.requiredBy(), Optional.empty()));
            }
            recordEdges(project, resolution.edges());

            for (InstallStep step : plan.stepsToInstall()) {
                if (!step.transitive() && current.containsKey(step.name())) {
                    manifests.addSkillToManifest(project, step.name(), source);
                }
            }
            InstallResult result = InstallResult.of(skills, tools, errors);
            LOGGER.info("Installed {}: {}", source, result.stats());
            return result;
        } catch (RuntimeException e) {
            LOGGER.warn("Install of {} failed: {}", source, e.getMessage());
            return InstallResult.failure(List.of(String.valueOf(e.getMessage())));
        }
    }

    /** Installs every skill declared in {@code skillpkg.json}. */
    public InstallResult installFromManifest(Path project, InstallOptions options) {
        Optional<ProjectManifest> manifest = manifests.loadManifest(project);
        if (manifest.isEmpty()) {
            return InstallResult.failure(List.of("No skillpkg.json found"));
        }
        List<InstallResult> results = new ArrayList<>();
        for (String source : manifest.get().skills().values()) {
            results.add(install(project, source, options));
        }
        return InstallResult.merge(results);
    }

    public UninstallCheck canUninstall(Path project, String name) {
        return ledger.canUninstall(project, name);
    }

    public UninstallResult uninstall(Path project, String name, UninstallOptions options) {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(options, "options");
        try {
            if (!ledger.isSkillInstalled(project, name) && !store.hasSkill(project, name)) {
                return UninstallResult.failure("Skill not found: " + name, List.of());
            }
            if (!options.force()) {
                UninstallCheck check = ledger.canUninstall(project, name);
                if (!check.ok()) {
                    return UninstallResult.failure("Cannot uninstall: " + name + " is required by: "
                            + String.join(", ", check.dependents()), check.dependents());
                }
            }
            if (options.dryRun()) {
                return new UninstallResult(true, List.of(name), List.of(), List.of(), List.of());
            }
            store.removeSkill(project, name);
            ledger.recordSkillUninstall(project, name);
            manifests.removeSkillFromManifest(project, name);

            List<String> orphans = options.removeOrphans() ? removeOrphans(project) : List.of();
            LOGGER.info("Uninstalled {} (orphans removed: {})", name, orphans);
            return new UninstallResult(true, List.of(name), orphans, List.of(), List.of());
        } catch (RuntimeException e) {
            LOGGER.warn("Uninstall of {} failed: {}", name, e.getMessage());
            return UninstallResult.failure(String.valueOf(e.getMessage()), List.of());
        }
    }

    private Optional<ResolutionResult> singleSkill(String source) {
        Optional<SkillMetadata> metadata = fetcher.fetchMetadata(source);
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        String name = SkillNames.fromSource(source);
        Map<String, List<String>> requirers = new LinkedHashMap<>();
        metadata.get().tools().forEach(tool -> requirers.put(tool, List.of(name)));
        return Optional.of(new ResolutionResult(List.of(ResolvedDependency.root(name, source)),
                List.copyOf(requirers.keySet()), requirers, List.of(), List.of(), Optional.empty()));
    }

    private SkillInstallResult installStep(Path project, InstallStep step) {
        try {
            Optional<FetchedSkill> fetched = fetcher.fetchSkill(step.source());
            if (fetched.isEmpty()) {
                return failed(step, "Failed to fetch skill from: " + step.source());
            }
            SkillMetadata metadata = fetched.get().metadata();
            String name = step.name();
            if (!name.equals(metadata.name())) {
                LOGGER.warn("SKILL.md name '{}' differs from '{}' derived from {}; using '{}'", metadata.name(), name,
                        step.source(), name);
            }
            SkillInstallAction action = store.hasSkill(project, name)
                    ? SkillInstallAction.UPDATED
                    : SkillInstallAction.INSTALLED;
            store.addSkill(project, name, fetched.get().contentDir(), metadata.version(), fetched.get().origin(),
                    Optional.of(step.source()));
            InstalledBy installedBy = step.transitive()
                    ? InstalledBy.skill(step.requiredBy().orElseThrow())
                    : InstalledBy.user();
            ledger.recordSkillInstall(project, name, metadata.version(), step.source(), installedBy);
            return new SkillInstallResult(name, metadata.version(), action, step.transitive(), step.requiredBy(),
                    Optional.empty());
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to install {}: {}", step.name(), e.getMessage());
            return failed(step, String.valueOf(e.getMessage()));
        }
    }

    private static SkillInstallResult failed(InstallStep step, String error) {
        return new SkillInstallResult(step.name(), "unknown", SkillInstallAction.FAILED, step.transitive(),
                step.requiredBy(), Optional.of(error));
    }

    /** Records every traversed relation whose two ends are now installed, including ones to skipped skills. */
    private void recordEdges(Path project, List<DependencyEdge> edges) {
        Set<String> installed = ledger.installedSkillNames(project);
        for (DependencyEdge edge : edges) {
            if (installed.contains(edge.dependent()) && installed.contains(edge.dependency())) {
                ledger.addDependency(project, edge.dependent(), edge.dependency());
            }
        }
    }

    private List<String> removeOrphans(Path project) {
        List<String> removed = new ArrayList<>();
        Set<String> attempted = new HashSet<>();
        List<String> orphans = ledger.getOrphanDependencies(project);
        while (!orphans.isEmpty()) {
            boolean progressed = false;
            for (String orphan : orphans) {
                if (attempted.add(orphan)) {
                    store.removeSkill(project, orphan);
                    ledger.recordSkillUninstall(project, orphan);
                    removed.add(orphan);
                    progressed = true;
                }
            }
            if (!progressed) {
                break;
            }
            orphans = ledger.getOrphanDependencies(project);
        }
        return removed;
    }
}
