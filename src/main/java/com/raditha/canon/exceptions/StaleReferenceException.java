package com.raditha.canon.exceptions;

/**
 * An edit targets a semantic node whose correspondence entry is unknown or was invalidated
 * by an earlier edit of the same patch.
 */
public class StaleReferenceException extends CanonException {

    public StaleReferenceException(String message, SourceLocation location, String operation) {
        super(message, location, operation);
    }
}
