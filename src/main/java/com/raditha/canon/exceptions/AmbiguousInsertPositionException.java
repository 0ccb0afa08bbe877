package com.raditha.canon.exceptions;

/**
 * A structural insert into a container that has no sibling to copy formatting from,
 * submitted without an explicit formatting hint.
 */
public class AmbiguousInsertPositionException extends CanonException {

    public AmbiguousInsertPositionException(String message, SourceLocation location) {
        super(message, location, "insert-child");
    }
}
