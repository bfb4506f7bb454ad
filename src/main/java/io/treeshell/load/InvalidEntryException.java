package io.treeshell.load;

/**
 * Raised by an {@link EntryValidator} when a configuration entry cannot be accepted.
 * Callers turn it into a validation warning; it never aborts a load.
 */
public class InvalidEntryException extends Exception {
    public InvalidEntryException(String reason) {
        super(reason);
    }
}
