package com.raditha.canon.exceptions;

/**
 * An edit that does not fit the node it targets, for example inserting a keyed child
 * into a sequence or moving a child outside its parent's bounds.
 */
public class InvalidEditException extends CanonException {

    public InvalidEditException(String message, SourceLocation location, String operation) {
        super(message, location, operation);
    }
}
