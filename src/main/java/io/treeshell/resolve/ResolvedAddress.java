package io.treeshell.resolve;

import io.treeshell.model.Node;

/**
 * @param typedAddress     the caller's base token with the view made explicit, e.g. {@code 0.0.10.0}
 * @param canonicalAddress the node id with the view made explicit, e.g. {@code system.echo.1.1}
 */
public record ResolvedAddress(
        Node node,
        View view,
        MatchRule rule,
        String typedAddress,
        String canonicalAddress
) {
    public String nodeId() {
        return node.id();
    }
}
