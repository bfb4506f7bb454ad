package io.treeshell.resolve;

import java.util.List;

/**
 * Raised when a token cannot be resolved to exactly one node. Returned to the caller of the
 * command; never fatal to the shell.
 */
public class AddressResolutionException extends RuntimeException {

    public enum Kind { NOT_FOUND, AMBIGUOUS }

    private final Kind kind;
    private final String token;
    private final List<String> candidates;

    public AddressResolutionException(Kind kind, String token, String message) {
        this(kind, token, message, List.of());
    }

    public AddressResolutionException(Kind kind, String token, String message, List<String> candidates) {
        super("[" + kind + "] " + message);
        this.kind = kind;
        this.token = token;
        this.candidates = List.copyOf(candidates);
    }

    public static AddressResolutionException notFound(String token) {
        return new AddressResolutionException(Kind.NOT_FOUND, token, "no node matches '" + token + "'");
    }

    public Kind getKind() { return kind; }

    public String getToken() { return token; }

    public List<String> getCandidates() { return candidates; }
}
