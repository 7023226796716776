package io.github.hide212131.skillpkg.state;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Installation record of an external tool.
 *
 * @param installedBySkill skill that required the tool; empty when it was added by hand
 */
public record ToolLedgerEntry(String packageIdentifier, Optional<String> installedBySkill, Instant installedAt) {

    public ToolLedgerEntry {
        Objects.requireNonNull(packageIdentifier, "packageIdentifier");
        installedBySkill = installedBySkill == null ? Optional.empty() : installedBySkill;
        Objects.requireNonNull(installedAt, "installedAt");
    }
}
