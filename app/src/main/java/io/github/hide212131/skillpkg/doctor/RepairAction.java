package io.github.hide212131.skillpkg.doctor;

public record RepairAction(RepairActionType type, String skillName, String description) {
}
