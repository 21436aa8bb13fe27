package com.di.logsift.group;

/**
 * Values of {@code diagnosis.status}. Grouping only ever writes {@link #PENDING}, on group
 * creation; the rest belong to the diagnosis workflow.
 */
public enum DiagnosisStatus {
    PENDING,
    IN_PROCESS,
    RESOLVED,
    IGNORE,
    DIAGNOSIS_COMPLETED
}
