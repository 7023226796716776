package io.github.hide212131.skillpkg.installer;

/**
 * @param force            reinstall skills even when the ledger already has them
 * @param skipDependencies install only the requested skill
 * @param dryRun           plan without touching the store, ledger or manifest
 */
public record InstallOptions(boolean force, boolean skipDependencies, boolean dryRun) {

    public static InstallOptions defaults() {
        return new InstallOptions(false, false, false);
    }
}
