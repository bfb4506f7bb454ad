package io.treeshell.resolve;

/**
 * Resolution rules in precedence order.
 */
public enum MatchRule {
    NUMERIC,
    SEMANTIC,
    BARE_NAME,
    ZONE,
    ALIAS
}
