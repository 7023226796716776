package io.github.hide212131.skillpkg.installer;

public record InstallStats(int installed, int updated, int skipped, int failed) {

    static InstallStats of(Iterable<SkillInstallResult> skills) {
        int installed = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        for (SkillInstallResult skill : skills) {
            switch (skill.action()) {
                case INSTALLED -> installed++;
                case UPDATED -> updated++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                default -> throw new IllegalStateException("unexpected action: " + skill.action());
            }
        }
        return new InstallStats(installed, updated, skipped, failed);
    }
}
