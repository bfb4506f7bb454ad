package io.treeshell.model;

import java.util.Map;

/**
 * A validated node of the shell graph. Implementations are immutable; the kind is fixed
 * by the implementing type ({@link MenuNode} or {@link CallableNode}).
 */
public interface Node {
    String SELECTOR_MENU = "0";
    String SELECTOR_ACTION = "1";

    String id();

    NodeKind kind();

    String label();

    String description();

    /**
     * Ordered selector to child-id map, not including the universal selectors.
     */
    Map<String, String> options();

    default boolean isCallable() {
        return kind() == NodeKind.CALLABLE;
    }

    default String leafName() {
        return leafOf(id());
    }

    static String leafOf(String id) {
        int dot = id.lastIndexOf('.');
        return dot < 0 ? id : id.substring(dot + 1);
    }

    static String familyOf(String id) {
        int dot = id.indexOf('.');
        return dot < 0 ? id : id.substring(0, dot);
    }

    static boolean isUniversalSelector(String selector) {
        return SELECTOR_MENU.equals(selector) || SELECTOR_ACTION.equals(selector);
    }
}
