package io.treeshell.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * One declared argument of a callable binding. A {@code sensitive} argument is masked
 * wherever its value is recorded.
 */
public record ArgSpec(ArgType type, boolean required, boolean sensitive) {

    public ArgSpec(ArgType type, boolean required) {
        this(type, required, false);
    }

    public enum ArgType {
        STRING,
        INTEGER,
        NUMBER,
        BOOLEAN,
        OBJECT,
        ARRAY,
        ANY;

        public static ArgType fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return ANY;
            }
            String value = raw.trim().toLowerCase(Locale.ROOT);
            return switch (value) {
                case "string", "str" -> STRING;
                case "integer", "int" -> INTEGER;
                case "number", "float", "double" -> NUMBER;
                case "boolean", "bool" -> BOOLEAN;
                case "object", "dict" -> OBJECT;
                case "array", "list" -> ARRAY;
                case "any" -> ANY;
                default -> throw new IllegalArgumentException("Unknown argument type: " + raw);
            };
        }

        public boolean accepts(JsonNode value) {
            if (value == null || value.isMissingNode()) {
                return false;
            }
            return switch (this) {
                case STRING -> value.isTextual();
                case INTEGER -> value.isIntegralNumber();
                case NUMBER -> value.isNumber();
                case BOOLEAN -> value.isBoolean();
                case OBJECT -> value.isObject();
                case ARRAY -> value.isArray();
                case ANY -> true;
            };
        }

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
