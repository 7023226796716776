package io.github.hide212131.skillpkg.doctor;

import java.util.List;
import java.util.Objects;

/** Outcome of {@link Doctor#diagnose}. {@code healthy} is true iff no issue has error severity. */
public record DiagnosisResult(boolean healthy, List<Issue> issues, DiagnosisStats stats) {

    public DiagnosisResult {
        issues = List.copyOf(issues);
        Objects.requireNonNull(stats, "stats");
    }

    static DiagnosisResult of(List<Issue> issues, DiagnosisStats stats) {
        boolean healthy = issues.stream().noneMatch(issue -> issue.severity() == IssueSeverity.ERROR);
        return new DiagnosisResult(healthy, issues, stats);
    }

    public List<Issue> issuesOf(IssueType type) {
        return issues.stream().filter(issue -> issue.type() == type).toList();
    }

    public long count(IssueSeverity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).count();
    }
}
