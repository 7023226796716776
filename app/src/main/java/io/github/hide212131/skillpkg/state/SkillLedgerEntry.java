package io.github.hide212131.skillpkg.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Installation record of one skill.
 *
 * @param dependedBy names of installed skills that require this one; ordered and free of duplicates
 */
public record SkillLedgerEntry(String version, String source, InstalledBy installedBy, Instant installedAt,
        List<String> dependedBy) {

    public SkillLedgerEntry {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(installedBy, "installedBy");
        Objects.requireNonNull(installedAt, "installedAt");
        dependedBy = List.copyOf(new LinkedHashSet<>(Objects.requireNonNull(dependedBy, "dependedBy")));
    }

    public SkillLedgerEntry withDependent(String dependent) {
        if (dependedBy.contains(dependent)) {
            return this;
        }
        List<String> updated = new ArrayList<>(dependedBy);
        updated.add(dependent);
        return new SkillLedgerEntry(version, source, installedBy, installedAt, updated);
    }

    public SkillLedgerEntry withoutDependents(Collection<String> removed) {
        List<String> updated = dependedBy.stream().filter(name -> !removed.contains(name)).toList();
        if (updated.size() == dependedBy.size()) {
            return this;
        }
        return new SkillLedgerEntry(version, source, installedBy, installedAt, updated);
    }

    public SkillLedgerEntry withVersion(String newVersion) {
        return new SkillLedgerEntry(newVersion, source, installedBy, installedAt, dependedBy);
    }
}
