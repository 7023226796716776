package io.github.hide212131.skillpkg.resolver;

/** What the installer does with one plan step. */
public enum InstallAction {
    INSTALL, SKIP
}
