package io.github.hide212131.skillpkg.doctor;

import io.github.hide212131.skillpkg.config.ManifestException;
import io.github.hide212131.skillpkg.config.ManifestStore;
import io.github.hide212131.skillpkg.config.ProjectManifest;
import io.github.hide212131.skillpkg.resolver.SkillNames;
import io.github.hide212131.skillpkg.state.Ledger;
import io.github.hide212131.skillpkg.state.SkillLedgerEntry;
import io.github.hide212131.skillpkg.state.StateLedger;
import io.github.hide212131.skillpkg.store.Registry;
import io.github.hide212131.skillpkg.store.RegistryEntry;
import io.github.hide212131.skillpkg.store.RegistrySource;
import io.github.hide212131.skillpkg.store.SkillStore;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds and repairs drift between the state ledger, the physical skill store, the store registry and the
 * project manifest.
 * <p>
 * Diagnosis is read-only. Repair mutates only through {@link StateLedger} and {@link SkillStore} operations.
 */
public final class Doctor {

    private static final Logger LOGGER = LoggerFactory.getLogger(Doctor.class);

    private static final Set<IssueType> BATCH_TYPES = EnumSet.of(IssueType.REGISTRY_WITHOUT_DISK,
            IssueType.LEDGER_WITHOUT_DISK, IssueType.DANGLING_DEPENDENCY);

    private final StateLedger ledger;
    private final SkillStore store;
    private final ManifestStore manifests;

    public Doctor(StateLedger ledger, SkillStore store, ManifestStore manifests) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.store = Objects.requireNonNull(store, "store");
        this.manifests = Objects.requireNonNull(manifests, "manifests");
    }

    public DiagnosisResult diagnose(Path project) {
        return diagnose(project, false);
    }

    /**
     * @param checkSync also report skills installed after the last recorded sync of a target
     */
    public DiagnosisResult diagnose(Path project, boolean checkSync) {
        Objects.requireNonNull(project, "project");
        Ledger state = ledger.load(project);
        Registry registry = store.getRegistry(project);
        List<String> diskNames = store.listSkillNames(project);
        Optional<ProjectManifest> manifest = loadManifest(project);

        Set<String> onDisk = new LinkedHashSet<>(diskNames);
        List<Issue> issues = new ArrayList<>();

        List<String> ledgerWithoutDisk = ledger.getOrphanLedgerEntries(project, diskNames);
        for (String name : ledgerWithoutDisk) {
            issues.add(Issue.of(IssueType.LEDGER_WITHOUT_DISK, name,
                    "Skill \"" + name + "\" is in state.json but has no files on disk", "Remove from state.json"));
        }
        for (String name : registry.skills().keySet()) {
            if (!onDisk.contains(name)) {
                issues.add(Issue.of(IssueType.REGISTRY_WITHOUT_DISK, name,
                        "Skill \"" + name + "\" is in registry.json but has no files on disk",
                        "Remove from registry.json"));
            }
        }
        for (String name : diskNames) {
            if (!registry.contains(name)) {
                issues.add(Issue.of(IssueType.DISK_WITHOUT_REGISTRY, name,
                        "Skill \"" + name + "\" exists on disk but not in registry.json",
                        "Add to registry.json or remove from disk"));
            }
        }
        Set<String> tracked = new LinkedHashSet<>(state.skillNames());
        tracked.addAll(registry.skills().keySet());
        for (String name : tracked) {
            if (!SkillNames.isValid(name)) {
                issues.add(Issue.of(IssueType.INVALID_NAME, name,
                        "Skill name \"" + name + "\" contains path separators",
                        "Reinstall with correct name from SKILL.md frontmatter"));
            }
        }
        state.skills().forEach((name, entry) -> registry.entry(name).ifPresent(registered -> {
            if (!entry.version().equals(registered.version())) {
                issues.add(Issue.of(IssueType.VERSION_MISMATCH, name,
                        "Version mismatch: state=" + entry.version() + ", registry=" + registered.version(),
                        "Update to latest version"));
            }
        }));
        manifest.ifPresent(declared -> state.skills().forEach((name, entry) -> {
            if (entry.installedBy().isUser() && !declared.declares(name)) {
                issues.add(Issue.of(IssueType.MISSING_MANIFEST_ENTRY, name,
                        "User-installed skill \"" + name + "\" is not in skillpkg.json",
                        "Add to skillpkg.json for team sharing"));
            }
        }));
        state.skills().forEach((name, entry) -> {
            for (String dependent : entry.dependedBy()) {
                if (!state.hasSkill(dependent)) {
                    issues.add(Issue.of(IssueType.DANGLING_DEPENDENCY, name,
                            "Skill \"" + name + "\" has dangling dependency reference to \"" + dependent + "\"",
                            "Clean up dependency references"));
                }
            }
        });
        for (String name : ledger.getOrphanDependencies(project)) {
            if (!ledgerWithoutDisk.contains(name)) {
                issues.add(Issue.of(IssueType.ORPHAN_DEPENDENCY, name,
                        "Skill \"" + name + "\" was installed as a dependency but is no longer needed",
                        "Remove unused dependency"));
            }
        }
        if (checkSync) {
            issues.addAll(syncIssues(state));
        }

        int synced = (int) registry.skills().values().stream().filter(RegistryEntry::isSynced).count();
        DiagnosisStats stats = new DiagnosisStats(state.skills().size(), registry.skills().size(), diskNames.size(),
                synced);
        return DiagnosisResult.of(issues, stats);
    }

    public RepairResult repair(Path project, RepairOptions options) {
        Objects.requireNonNull(options, "options");
        DiagnosisResult diagnosis = diagnose(project, options.resync());
        List<Issue> toFix = options.autoOnly()
                ? diagnosis.issues().stream().filter(Issue::autoFixable).toList()
                : diagnosis.issues();

        List<RepairAction> actions = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        if (options.dryRun()) {
            Ledger state = ledger.load(project);
            for (Issue issue : toFix) {
                plannedAction(issue, state, options).ifPresent(actions::add);
            }
            return new RepairResult(true, actions, errors, 0, diagnosis.issues().size());
        }

        int fixed = 0;
        if (options.removeOrphans() && has(toFix, IssueType.REGISTRY_WITHOUT_DISK)) {
            try {
                for (String name : store.cleanOrphans(project)) {
                    fixed++;
                    actions.add(new RepairAction(RepairActionType.REMOVE_REGISTRY, name,
                            "Remove \"" + name + "\" from registry.json"));
                }
            } catch (RuntimeException e) {
                errors.add("Failed to clean orphan registry entries: " + e.getMessage());
            }
        }
        if (options.removeOrphans() && has(toFix, IssueType.LEDGER_WITHOUT_DISK)) {
            try {
                for (String name : ledger.cleanOrphanLedgerEntries(project, store.listSkillNames(project))) {
                    fixed++;
                    actions.add(new RepairAction(RepairActionType.REMOVE_STATE, name,
                            "Remove \"" + name + "\" from state.json"));
                }
            } catch (RuntimeException e) {
                errors.add("Failed to clean orphan state entries: " + e.getMessage());
            }
        }
        List<Issue> dangling = toFix.stream().filter(issue -> issue.type() == IssueType.DANGLING_DEPENDENCY).toList();
        if (!dangling.isEmpty()) {
            try {
                int pruned = ledger.cleanDanglingReferences(project);
                LOGGER.debug("Pruned {} dangling references", pruned);
                fixed += dangling.size();
                Set<String> reported = new HashSet<>();
                for (Issue issue : dangling) {
                    if (reported.add(issue.skillName())) {
                        actions.add(new RepairAction(RepairActionType.UPDATE_STATE, issue.skillName(),
                                "Clean dependency references for \"" + issue.skillName() + "\""));
                    }
                }
            } catch (RuntimeException e) {
                errors.add("Failed to clean dangling references: " + e.getMessage());
            }
        }

        for (Issue issue : toFix) {
            if (BATCH_TYPES.contains(issue.type())) {
                continue;
            }
            try {
                Optional<RepairAction> action = fix(project, issue, options);
                if (action.isPresent()) {
                    fixed++;
                    actions.add(action.get());
                }
            } catch (RuntimeException e) {
                errors.add("Failed to fix " + issue.type().value() + " for " + issue.skillName() + ": "
                        + e.getMessage());
            }
        }

        if (options.removeOrphans()) {
            reclaimOrphanChain(project, actions, errors);
        }

        int remaining = Math.max(0, diagnosis.issues().size() - fixed);
        LOGGER.info("Repair finished: {} fixed, {} remaining, {} errors", fixed, remaining, errors.size());
        return new RepairResult(errors.isEmpty(), actions, errors, fixed, remaining);
    }

    private Optional<RepairAction> fix(Path project, Issue issue, RepairOptions options) {
        String name = issue.skillName();
        switch (issue.type()) {
            case DISK_WITHOUT_REGISTRY: {
                Optional<SkillLedgerEntry> tracked = ledger.load(project).skill(name);
                if (tracked.isPresent()) {
                    SkillLedgerEntry entry = tracked.get();
                    store.registerSkill(project, RegistryEntry.of(name, entry.version(), entry.installedAt(),
                            registrySource(entry.source()), Optional.of(entry.source())));
                    return Optional.of(new RepairAction(RepairActionType.ADD_REGISTRY, name,
                            "Register \"" + name + "\" in registry.json from state.json"));
                }
                if (!options.removeOrphans()) {
                    return Optional.empty();
                }
                store.removeSkill(project, name);
                return Optional.of(new RepairAction(RepairActionType.REMOVE_DIRECTORY, name,
                        "Remove orphan skill directory \"" + name + "\""));
            }
            case INVALID_NAME: {
                if (!options.removeOrphans()) {
                    return Optional.empty();
                }
                boolean changed = false;
                if (ledger.isSkillInstalled(project, name)) {
                    ledger.recordSkillUninstall(project, name);
                    changed = true;
                }
                // Only a top-level store directory is removed; "a/b" must not reach into skill "a".
                if (store.listSkillNames(project).contains(name)) {
                    changed |= store.removeSkill(project, name);
                }
                changed |= store.removeRegistryEntry(project, name);
                if (!changed) {
                    return Optional.empty();
                }
                return Optional.of(new RepairAction(RepairActionType.REMOVE_STATE, name,
                        "Remove invalid skill name \"" + name + "\""));
            }
            case VERSION_MISMATCH: {
                Optional<RegistryEntry> registered = store.getRegistry(project).entry(name);
                if (registered.isEmpty() || !ledger.updateSkillVersion(project, name, registered.get().version())) {
                    return Optional.empty();
                }
                return Optional.of(new RepairAction(RepairActionType.UPDATE_STATE, name,
                        "Sync version for \"" + name + "\""));
            }
            case ORPHAN_DEPENDENCY: {
                if (!options.removeOrphans()) {
                    return Optional.empty();
                }
                removeOrphan(project, name);
                return Optional.of(new RepairAction(RepairActionType.REMOVE_SKILL, name,
                        "Remove unused dependency \"" + name + "\""));
            }
            default:
                return Optional.empty();
        }
    }

    /** Removing one orphan can make its own dependencies orphans. Keep going until none are left. */
    private void reclaimOrphanChain(Path project, List<RepairAction> actions, List<String> errors) {
        Set<String> attempted = new HashSet<>();
        List<String> orphans = ledger.getOrphanDependencies(project);
        while (!orphans.isEmpty()) {
            boolean progressed = false;
            for (String name : orphans) {
                if (!attempted.add(name)) {
                    continue;
                }
                try {
                    removeOrphan(project, name);
                    actions.add(new RepairAction(RepairActionType.REMOVE_SKILL, name,
                            "Remove unused dependency \"" + name + "\""));
                    progressed = true;
                } catch (RuntimeException e) {
                    errors.add("Failed to fix " + IssueType.ORPHAN_DEPENDENCY.value() + " for " + name + ": "
                            + e.getMessage());
                }
            }
            if (!progressed) {
                return;
            }
            orphans = ledger.getOrphanDependencies(project);
        }
    }

    private void removeOrphan(Path project, String name) {
        if (store.hasSkill(project, name) || store.getRegistry(project).contains(name)) {
            store.removeSkill(project, name);
        }
        ledger.recordSkillUninstall(project, name);
    }

    private Optional<RepairAction> plannedAction(Issue issue, Ledger state, RepairOptions options) {
        String name = issue.skillName();
        boolean destructive = options.removeOrphans();
        switch (issue.type()) {
            case LEDGER_WITHOUT_DISK:
                return destructive ? Optional.of(new RepairAction(RepairActionType.REMOVE_STATE, name,
                        "Remove \"" + name + "\" from state.json")) : Optional.empty();
            case REGISTRY_WITHOUT_DISK:
                return destructive ? Optional.of(new RepairAction(RepairActionType.REMOVE_REGISTRY, name,
                        "Remove \"" + name + "\" from registry.json")) : Optional.empty();
            case DISK_WITHOUT_REGISTRY:
                if (state.hasSkill(name)) {
                    return Optional.of(new RepairAction(RepairActionType.ADD_REGISTRY, name,
                            "Register \"" + name + "\" in registry.json from state.json"));
                }
                return destructive ? Optional.of(new RepairAction(RepairActionType.REMOVE_DIRECTORY, name,
                        "Remove orphan skill directory \"" + name + "\"")) : Optional.empty();
            case INVALID_NAME:
                return destructive ? Optional.of(new RepairAction(RepairActionType.REMOVE_STATE, name,
                        "Remove invalid skill name \"" + name + "\"")) : Optional.empty();
            case VERSION_MISMATCH:
                return Optional.of(new RepairAction(RepairActionType.UPDATE_STATE, name,
                        "Sync version for \"" + name + "\""));
            case DANGLING_DEPENDENCY:
                return Optional.of(new RepairAction(RepairActionType.UPDATE_STATE, name,
                        "Clean dependency references for \"" + name + "\""));
            case ORPHAN_DEPENDENCY:
                return destructive ? Optional.of(new RepairAction(RepairActionType.REMOVE_SKILL, name,
                        "Remove unused dependency \"" + name + "\"")) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private List<Issue> syncIssues(Ledger state) {
        List<Issue> issues = new ArrayList<>();
        if (state.syncHistory().isEmpty()) {
            return issues;
        }
        state.skills().forEach((name, entry) -> {
            List<String> outdated = new ArrayList<>();
            for (Map.Entry<String, Instant> sync : state.syncHistory().entrySet()) {
                if (entry.installedAt().isAfter(sync.getValue())) {
                    outdated.add(sync.getKey());
                }
            }
            if (!outdated.isEmpty()) {
                issues.add(Issue.of(IssueType.SYNC_OUTDATED, name,
                        "Skill \"" + name + "\" changed after the last sync to " + String.join(", ", outdated),
                        "Run sync again"));
            }
        });
        return issues;
    }

    private Optional<ProjectManifest> loadManifest(Path project) {
        try {
            return manifests.loadManifest(project);
        } catch (ManifestException e) {
            LOGGER.warn("Skipping manifest check: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean has(List<Issue> issues, IssueType type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }

    private static RegistrySource registrySource(String source) {
        return source.startsWith("github:") || source.startsWith("http://") || source.startsWith("https://")
                ? RegistrySource.IMPORT
                : RegistrySource.LOCAL;
    }
}
