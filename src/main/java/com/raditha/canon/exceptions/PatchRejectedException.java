package com.raditha.canon.exceptions;

/**
 * A transactional patch was rolled back because one of its edits failed. The cause is the
 * failure of that edit; the original document is unchanged.
 */
public class PatchRejectedException extends CanonException {

    private final int editIndex;

    public PatchRejectedException(int editIndex, CanonException cause) {
        super("Patch rejected at edit #" + editIndex + ": " + cause.getMessage(),
                cause.getLocation(), cause.getOperation(), cause);
        this.editIndex = editIndex;
    }

    public int getEditIndex() {
        return editIndex;
    }
}
