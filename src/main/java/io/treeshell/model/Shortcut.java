package io.treeshell.model;

import java.util.Locale;

public record Shortcut(
        String alias,
        Type type,
        String target,
        String description
) {
    public enum Type {
        JUMP,
        CHAIN;

        public static Type fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return JUMP;
            }
            return Type.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }
}
