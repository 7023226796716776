package io.github.hide212131.skillpkg.state;

/**
 * A dependency relation was recorded against a skill that has no ledger entry. This is a caller bug, not a
 * data condition.
 */
public class DependencyNotFoundException extends IllegalStateException {

    private final String dependency;

    public DependencyNotFoundException(String dependency) {
        super("Dependency skill not found: " + dependency);
        this.dependency = dependency;
    }

    public String dependency() {
        return dependency;
    }
}
