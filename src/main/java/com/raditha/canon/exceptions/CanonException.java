package com.raditha.canon.exceptions;

/**
 * Base class for every user-facing failure raised by the normalization and patch-back pipeline.
 * Each failure names the node it happened on and the rule or operation involved.
 */
public class CanonException extends RuntimeException {

    private final transient SourceLocation location;
    private final String operation;

    public CanonException(String message, SourceLocation location, String operation) {
        this(message, location, operation, null);
    }

    public CanonException(String message, SourceLocation location, String operation, Throwable cause) {
        super(format(message, location, operation), cause);
        this.location = location == null ? SourceLocation.UNKNOWN : location;
        this.operation = operation;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getOperation() {
        return operation;
    }

    private static String format(String message, SourceLocation location, String operation) {
        StringBuilder sb = new StringBuilder(message);
        if (location != null) {
            sb.append(" at ").append(location);
        }
        if (operation != null) {
            sb.append(" [").append(operation).append(']');
        }
        return sb.toString();
    }
}
