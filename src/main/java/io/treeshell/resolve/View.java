package io.treeshell.resolve;

/**
 * Universal selector views every node exposes: {@code .0} menu, {@code .1.0} argument review,
 * {@code .1.1} execute.
 */
public enum View {
    MENU("0"),
    ACTION("1.0"),
    EXECUTE("1.1");

    private final String suffix;

    View(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * View named by a stripped selector tail, or {@code null} when the tail is not a view.
     */
    static View fromTail(String tail) {
        return switch (tail) {
            case "", "0" -> MENU;
            case "1", "1.0" -> ACTION;
            case "1.1" -> EXECUTE;
            default -> null;
        };
    }
}
