package io.github.hide212131.skillpkg.doctor;

import java.util.Locale;

public enum IssueSeverity {
    ERROR,
    WARNING,
    INFO;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
