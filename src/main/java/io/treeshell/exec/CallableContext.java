package io.treeshell.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record CallableContext(
        String nodeId,
        String functionName,
        ObjectNode args,
        String actor
) {
}
