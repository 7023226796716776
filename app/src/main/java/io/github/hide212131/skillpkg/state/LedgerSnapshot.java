package io.github.hide212131.skillpkg.state;

import java.util.Objects;

/**
 * Result of reading {@code state.json}.
 *
 * @param recovered true when a file existed but could not be used and an empty ledger was substituted
 */
public record LedgerSnapshot(Ledger ledger, boolean recovered) {

    public LedgerSnapshot {
        Objects.requireNonNull(ledger, "ledger");
    }
}
