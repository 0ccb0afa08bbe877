package com.raditha.canon.exceptions;

/**
 * Reassembling an unedited tree did not reproduce the source bytes. This is always a defect in
 * a grammar or in the reassembler, never a condition callers should retry.
 */
public class RoundTripMismatchException extends IllegalStateException {

    private final int offset;

    public RoundTripMismatchException(String grammar, int offset, int line, int column, String expected, String actual) {
        super("Round trip through '" + grammar + "' diverged at offset " + offset
                + " (line " + line + ", column " + column + "): expected '" + expected
                + "' but reassembled '" + actual + "'");
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
