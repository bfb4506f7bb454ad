package io.treeshell.model;

public enum WorkflowStatus {
    UNRAN,
    QUARANTINE,
    GOLDEN
}
