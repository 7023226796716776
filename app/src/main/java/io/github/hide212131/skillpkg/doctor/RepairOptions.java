package io.github.hide212131.skillpkg.doctor;

/**
 * @param autoOnly      only touch issues that are auto-fixable
 * @param dryRun        report the actions without writing anything
 * @param removeOrphans allow destructive cleanup of orphaned entries and directories
 * @param resync        also evaluate sync freshness
 */
public record RepairOptions(boolean autoOnly, boolean dryRun, boolean removeOrphans, boolean resync) {

    public static RepairOptions defaults() {
        return new RepairOptions(false, false, true, false);
    }

    public RepairOptions withDryRun(boolean value) {
        return new RepairOptions(autoOnly, value, removeOrphans, resync);
    }
}
