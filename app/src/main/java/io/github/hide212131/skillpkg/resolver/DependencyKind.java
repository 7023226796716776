package io.github.hide212131.skillpkg.resolver;

/** Kind of a resolved dependency. */
public enum DependencyKind {
    SKILL, EXTERNAL_TOOL
}
