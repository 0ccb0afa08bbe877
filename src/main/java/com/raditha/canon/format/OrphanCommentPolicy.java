package com.raditha.canon.format;

/**
 * Where comments go when the node they were attached to is deleted.
 */
public enum OrphanCommentPolicy {
    /** Keep the comment after the previous sibling; fall back to the next one. */
    ATTACH_TO_PREVIOUS,

    /** Keep the comment before the next sibling; fall back to the previous one. */
    ATTACH_TO_NEXT;

    public static OrphanCommentPolicy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OrphanCommentPolicy value cannot be null");
        }
        return switch (value.toLowerCase().replace('-', '_')) {
            case "previous", "attach_to_previous" -> ATTACH_TO_PREVIOUS;
            case "next", "attach_to_next" -> ATTACH_TO_NEXT;
            default -> throw new IllegalArgumentException(
                    "Invalid orphan comment policy: " + value + ". Must be: previous or next");
        };
    }
}
