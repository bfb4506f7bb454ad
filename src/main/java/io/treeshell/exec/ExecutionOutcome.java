package io.treeshell.exec;

import com.fasterxml.jackson.databind.JsonNode;
import io.treeshell.model.WorkflowRecord;

public record ExecutionOutcome(
        String nodeId,
        String functionName,
        JsonNode result,
        long durationMs,
        WorkflowRecord record
) {
}
