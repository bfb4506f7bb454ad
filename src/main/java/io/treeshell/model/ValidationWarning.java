package io.treeshell.model;

public record ValidationWarning(
        Layer layer,
        String nodeId,
        String reason
) {
    public enum Layer {
        SYSTEM,
        USER
    }

    public static ValidationWarning system(String nodeId, String reason) {
        return new ValidationWarning(Layer.SYSTEM, nodeId, reason);
    }

    public static ValidationWarning user(String nodeId, String reason) {
        return new ValidationWarning(Layer.USER, nodeId, reason);
    }

    @Override
    public String toString() {
        return layer.name().toLowerCase() + " " + (nodeId == null ? "-" : nodeId) + ": " + reason;
    }
}
