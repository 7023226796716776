package io.github.hide212131.skillpkg.doctor;

import java.util.Locale;

public enum RepairActionType {
    REMOVE_STATE,
    REMOVE_REGISTRY,
    ADD_REGISTRY,
    REMOVE_DIRECTORY,
    UPDATE_STATE,
    REMOVE_SKILL;

    public String value() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
