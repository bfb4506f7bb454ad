package io.treeshell.load;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.function.Consumer;

/**
 * Turns one raw keyed configuration entry into its typed value.
 *
 * @param <T> typed value produced for a valid entry
 */
@FunctionalInterface
public interface EntryValidator<T> {
    /**
     * @param notes receives non-fatal remarks (the entry is still accepted)
     */
    T validate(String id, ObjectNode raw, Consumer<String> notes) throws InvalidEntryException;
}
