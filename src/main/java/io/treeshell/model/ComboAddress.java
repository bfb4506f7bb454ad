package io.treeshell.model;

/**
 * A numeric coordinate paired with the semantic path it was assigned from.
 * Only the nav map creates these, so every instance is a verified pairing.
 */
public record ComboAddress(String coordinate, String semanticPath) {
    public static final String SEPARATOR = "::";

    public static boolean looksLikeCombo(String reference) {
        return reference != null && reference.contains(SEPARATOR);
    }

    @Override
    public String toString() {
        return coordinate + SEPARATOR + semanticPath;
    }
}
