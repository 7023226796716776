package io.github.hide212131.skillpkg.doctor;

import java.util.Objects;

public record Issue(IssueType type, IssueSeverity severity, String skillName, String message, String suggestion,
        boolean autoFixable) {

    public Issue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(skillName, "skillName");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(suggestion, "suggestion");
    }

    static Issue of(IssueType type, String skillName, String message, String suggestion) {
        return new Issue(type, type.severity(), skillName, message, suggestion, type.autoFixable());
    }
}
