package io.github.hide212131.skillpkg.installer;

/**
 * @param force         remove even when other installed skills depend on it
 * @param removeOrphans also remove dependencies that nothing needs any more
 */
public record UninstallOptions(boolean force, boolean removeOrphans, boolean dryRun) {

    public static UninstallOptions defaults() {
        return new UninstallOptions(false, false, false);
    }
}
