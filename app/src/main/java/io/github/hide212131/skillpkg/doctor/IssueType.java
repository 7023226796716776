package io.github.hide212131.skillpkg.doctor;

import java.util.Locale;

/** Kinds of drift between the ledger, the skill store, its registry and the manifest. Declared in check order. */
public enum IssueType {
    /** In the ledger, no skill directory. */
    LEDGER_WITHOUT_DISK(IssueSeverity.ERROR, true),
    /** In the registry, no skill directory. */
    REGISTRY_WITHOUT_DISK(IssueSeverity.ERROR, true),
    /** Skill directory present, not registered. */
    DISK_WITHOUT_REGISTRY(IssueSeverity.WARNING, true),
    /** A tracked name contains a path separator. */
    INVALID_NAME(IssueSeverity.ERROR, true),
    VERSION_MISMATCH(IssueSeverity.WARNING, true),
    /** A user-installed skill the manifest does not declare. */
    MISSING_MANIFEST_ENTRY(IssueSeverity.INFO, false),
    /** A {@code dependedBy} reference to a skill with no ledger entry. */
    DANGLING_DEPENDENCY(IssueSeverity.WARNING, true),
    ORPHAN_DEPENDENCY(IssueSeverity.WARNING, true),
    /** Installed after the last sync to a target. Only checked on request. */
    SYNC_OUTDATED(IssueSeverity.INFO, false);

    private final IssueSeverity severity;
    private final boolean autoFixable;

    IssueType(IssueSeverity severity, boolean autoFixable) {
        this.severity = severity;
        this.autoFixable = autoFixable;
    }

    public IssueSeverity severity() {
        return severity;
    }

    public boolean autoFixable() {
        return autoFixable;
    }

    /** Kebab-case name used in reports, e.g. {@code ledger-without-disk}. */
    public String value() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
