package io.github.hide212131.skillpkg.state;

import io.github.hide212131.skillpkg.state.LedgerCodec.LedgerFormatException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of {@code <project>/.skillpkg/state.json}: which skills and tools are installed, who installed them,
 * and which installed skills depend on each other.
 * <p>
 * Every mutating operation is a complete load, mutate and save cycle. The cycle is serialized on a
 * process-local lock; separate processes writing the same project are not coordinated and the last
 * writer wins.
 */
public final class StateLedger {

    public static final String STATE_DIR = ".skillpkg";
    public static final String STATE_FILE = "state.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(StateLedger.class);
    private static final ReentrantLock LOCK = new ReentrantLock();

    private final String stateDir;
    private final Clock clock;

    public StateLedger() {
        this(Clock.systemUTC());
    }

    public StateLedger(Clock clock) {
        this(STATE_DIR, clock);
    }

    /** Ledger kept under {@code <project>/<stateDir>}, next to a store moved by {@code SKILLPKG_STORE_DIR}. */
    public StateLedger(String stateDir, Clock clock) {
        this.stateDir = Objects.requireNonNull(stateDir, "stateDir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Location of the ledger in the default state directory. */
    public static Path statePath(Path project) {
        return project.resolve(STATE_DIR).resolve(STATE_FILE);
    }

    public Path ledgerPath(Path project) {
        return project.resolve(stateDir).resolve(STATE_FILE);
    }

    /** Returns the persisted ledger, or an empty one when nothing usable is on disk. Never throws. */
    public Ledger load(Path project) {
        return loadSnapshot(project).ledger();
    }

    public LedgerSnapshot loadSnapshot(Path project) {
        Path path = ledgerPath(project);
        if (!Files.exists(path)) {
            return new LedgerSnapshot(Ledger.empty(), false);
        }
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            return new LedgerSnapshot(LedgerCodec.decode(json), false);
        } catch (IOException | LedgerFormatException e) {
            LOGGER.warn("Discarding unreadable ledger {}: {}", path, e.getMessage());
            return new LedgerSnapshot(Ledger.empty(), true);
        } catch (RuntimeException e) {
            LOGGER.warn("Discarding invalid ledger {}: {}", path, e.toString());
            return new LedgerSnapshot(Ledger.empty(), true);
        }
    }

    /** Writes the ledger through a temporary file that is then moved over {@code state.json}. */
    public void save(Path project, Ledger ledger) {
        Objects.requireNonNull(ledger, "ledger");
        Path path = ledgerPath(project);
        Path temp = path.resolveSibling(STATE_FILE + ".tmp");
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(temp, LedgerCodec.encode(ledger), StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("state.json の書き込みに失敗しました: " + path, e);
        }
    }

    /**
     * Records an install. An existing entry keeps its {@code dependedBy} set, and an entry the user
     * installed stays a user install when a dependent reinstalls it.
     */
    public void recordSkillInstall(Path project, String name, String version, String source,
            InstalledBy installedBy) {
        Objects.requireNonNull(name, "name");
        mutate(project, ledger -> {
            Optional<SkillLedgerEntry> existing = ledger.skill(name);
            List<String> dependedBy = existing.map(SkillLedgerEntry::dependedBy).orElse(List.of());
            InstalledBy effective = existing.filter(entry -> entry.installedBy().isUser()).isPresent()
                    ? InstalledBy.user()
                    : installedBy;
            ledger.putSkill(name, new SkillLedgerEntry(version, source, effective, now(), dependedBy));
            LOGGER.debug("Recorded install of {} {} ({})", name, version, effective.token());
            return null;
        });
    }

    /** Removes the entry and every {@code dependedBy} reference to it. No-op when absent. */
    public void recordSkillUninstall(Path project, String name) {
        mutate(project, ledger -> {
            ledger.removeSkill(name);
            pruneReferences(ledger, Set.of(name));
            return null;
        });
    }

    /**
     * Records that {@code dependent} requires {@code dependency}.
     *
     * @throws DependencyNotFoundException when {@code dependency} has no ledger entry
     */
    public void addDependency(Path project, String dependent, String dependency) {
        mutate(project, ledger -> {
            SkillLedgerEntry entry = ledger.skill(dependency)
                    .orElseThrow(() -> new DependencyNotFoundException(dependency));
            ledger.putSkill(dependency, entry.withDependent(dependent));
            return null;
        });
    }

    public void removeDependency(Path project, String dependent, String dependency) {
        mutate(project, ledger -> {
            ledger.skill(dependency).ifPresent(
                    entry -> ledger.putSkill(dependency, entry.withoutDependents(Set.of(dependent))));
            return null;
        });
    }

    public UninstallCheck canUninstall(Path project, String name) {
        List<String> dependents = load(project).skill(name).map(SkillLedgerEntry::dependedBy).orElse(List.of());
        return new UninstallCheck(dependents.isEmpty(), dependents);
    }

    /**
     * Skills installed on behalf of another skill that nothing depends on any more and whose installer
     * has itself been uninstalled. Only the immediate installer is checked.
     */
    public List<String> getOrphanDependencies(Path project) {
        Ledger ledger = load(project);
        List<String> orphans = new ArrayList<>();
        ledger.skills().forEach((name, entry) -> {
            Optional<String> installer = entry.installedBy().skillName();
            if (installer.isPresent() && entry.dependedBy().isEmpty() && !ledger.hasSkill(installer.get())) {
                orphans.add(name);
            }
        });
        return orphans;
    }

    public List<String> getOrphanLedgerEntries(Path project, Collection<String> diskNames) {
        Set<String> onDisk = Set.copyOf(diskNames);
        return load(project).skillNames().stream().filter(name -> !onDisk.contains(name)).toList();
    }

    /** Removes every entry without a physical skill and prunes references to them. Returns the removed names. */
    public List<String> cleanOrphanLedgerEntries(Path project, Collection<String> diskNames) {
        Set<String> onDisk = Set.copyOf(diskNames);
        return mutate(project, ledger -> {
            List<String> removed = ledger.skillNames().stream().filter(name -> !onDisk.contains(name)).toList();
            if (removed.isEmpty()) {
                return removed;
            }
            removed.forEach(ledger::removeSkill);
            pruneReferences(ledger, Set.copyOf(removed));
            LOGGER.info("Removed {} ledger entries without a skill directory: {}", removed.size(), removed);
            return removed;
        });
    }

    /** Drops {@code dependedBy} references to names that have no ledger entry. Returns the number dropped. */
    public int cleanDanglingReferences(Path project) {
        return mutate(project, ledger -> {
            int pruned = 0;
            Map<String, SkillLedgerEntry> updated = new LinkedHashMap<>();
            for (Map.Entry<String, SkillLedgerEntry> e : ledger.skills().entrySet()) {
                SkillLedgerEntry entry = e.getValue();
                List<String> dangling = entry.dependedBy().stream().filter(ref -> !ledger.hasSkill(ref)).toList();
                pruned += dangling.size();
                updated.put(e.getKey(), entry.withoutDependents(dangling));
            }
            ledger.replaceSkills(updated);
            return pruned;
        });
    }

    public boolean updateSkillVersion(Path project, String name, String version) {
        return mutate(project, ledger -> {
            Optional<SkillLedgerEntry> entry = ledger.skill(name);
            entry.ifPresent(value -> ledger.putSkill(name, value.withVersion(version)));
            return entry.isPresent();
        });
    }

    public void recordToolInstall(Path project, String name, String packageIdentifier,
            Optional<String> installedBySkill) {
        mutate(project, ledger -> {
            ledger.putTool(name, new ToolLedgerEntry(packageIdentifier, installedBySkill, now()));
            return null;
        });
    }

    public boolean recordToolUninstall(Path project, String name) {
        return mutate(project, ledger -> ledger.removeTool(name));
    }

    public void recordSync(Path project, String target) {
        mutate(project, ledger -> {
            ledger.putSync(target, now());
            return null;
        });
    }

    public Optional<Instant> lastSync(Path project, String target) {
        return Optional.ofNullable(load(project).syncHistory().get(target));
    }

    /** Installed skills that depend on {@code name}. */
    public List<String> getDependents(Path project, String name) {
        return load(project).skill(name).map(SkillLedgerEntry::dependedBy).orElse(List.of());
    }

    /** Installed skills that {@code name} depends on. */
    public List<String> getDependencies(Path project, String name) {
        List<String> dependencies = new ArrayList<>();
        load(project).skills().forEach((other, entry) -> {
            if (entry.dependedBy().contains(name)) {
                dependencies.add(other);
            }
        });
        return dependencies;
    }

    public boolean isSkillInstalled(Path project, String name) {
        return load(project).hasSkill(name);
    }

    public Set<String> installedSkillNames(Path project) {
        return new LinkedHashSet<>(load(project).skillNames());
    }

    /**
     * Follows {@code installedBy} from {@code name} back to the skill the user asked for. The first element is
     * {@code name}; the chain stops at a user install, a missing entry, or a repeated name.
     */
    public List<String> installChain(Path project, String name) {
        Ledger ledger = load(project);
        List<String> chain = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        String current = name;
        while (current != null && seen.add(current)) {
            Optional<SkillLedgerEntry> entry = ledger.skill(current);
            if (entry.isEmpty()) {
                break;
            }
            chain.add(current);
            current = entry.get().installedBy().skillName().orElse(null);
        }
        return chain;
    }

    private <T> T mutate(Path project, Function<Ledger, T> change) {
        LOCK.lock();
        try {
            Ledger ledger = load(project);
            T result = change.apply(ledger);
            save(project, ledger);
            return result;
        } finally {
            LOCK.unlock();
        }
    }

    private static void pruneReferences(Ledger ledger, Set<String> names) {
        Map<String, SkillLedgerEntry> updated = new LinkedHashMap<>();
        ledger.skills().forEach((key, entry) -> updated.put(key, entry.withoutDependents(names)));
        ledger.replaceSkills(updated);
    }

    private Instant now() {
        return clock.instant();
    }
}
