package io.treeshell.model;

public record NavEntry(
        String coordinate,
        String family,
        int priority,
        boolean explicit
) {
}
