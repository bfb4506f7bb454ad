package io.treeshell.nav;

import java.util.List;

/**
 * A nav configuration that would break the coordinate/family bijection. Fatal: the
 * configuration carrying it is never activated.
 */
public class NavConflictException extends RuntimeException {
    private final List<String> conflicts;

    public NavConflictException(List<String> conflicts) {
        super("Nav configuration rejected: " + String.join("; ", conflicts));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<String> conflicts() {
        return conflicts;
    }
}
