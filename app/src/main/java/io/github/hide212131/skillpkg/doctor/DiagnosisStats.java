package io.github.hide212131.skillpkg.doctor;

public record DiagnosisStats(int ledgerCount, int registryCount, int diskCount, int syncedCount) {
}
