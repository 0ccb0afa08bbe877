package com.raditha.canon.patch;

/**
 * What happens to a patch when one of its edits cannot be applied.
 */
public enum TransactionMode {
    /** Reject the whole patch; the original document stays as it was. */
    ALL_OR_NOTHING,
    /** Skip the failing edit, keep the others, and report the failure. */
    BEST_EFFORT;

    public static TransactionMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TransactionMode value cannot be null");
        }
        return switch (value.toLowerCase().replace('_', '-')) {
            case "all-or-nothing", "atomic" -> ALL_OR_NOTHING;
            case "best-effort" -> BEST_EFFORT;
            default -> throw new IllegalArgumentException(
                    "Invalid transaction mode: " + value + ". Must be: all-or-nothing or best-effort");
        };
    }
}
