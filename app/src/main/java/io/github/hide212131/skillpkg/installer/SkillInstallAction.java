package io.github.hide212131.skillpkg.installer;

public enum SkillInstallAction {
    INSTALLED,
    UPDATED,
    SKIPPED,
    FAILED
}
