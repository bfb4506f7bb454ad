package io.treeshell.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class CommandLineParser {
    private static final Set<String> WRITE_COMMANDS = Set.of("chain", "shortcut", "save_pathway", "follow", "approve", "revoke", "reload");

    private CommandLineParser() {
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (token != null && !token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    /**
     * Text after the first {@code count} whitespace-separated tokens, with its inner spacing
     * preserved (JSON arguments keep their string contents intact).
     */
    static String rawTail(String raw, int count) {
        if (raw == null) {
            return "";
        }
        String rest = raw.strip();
        for (int i = 0; i < count; i++) {
            int space = indexOfWhitespace(rest);
            if (space < 0) {
                return "";
            }
            rest = rest.substring(space).strip();
        }
        return rest;
    }

    static boolean isWriteCommand(String op) {
        if (op == null || op.isBlank()) {
            return false;
        }
        return WRITE_COMMANDS.contains(op.trim().toLowerCase(Locale.ROOT));
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
