package com.raditha.canon.reassembly;

import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.cst.LineMap;
import com.raditha.canon.exceptions.RoundTripMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the round-trip law: reassembling a freshly parsed tree yields its source byte for byte.
 */
public class RoundTripVerifier {

    private static final Logger logger = LoggerFactory.getLogger(RoundTripVerifier.class);
    private static final int CONTEXT = 20;

    private final Reassembler reassembler;

    public RoundTripVerifier() {
        this(new Reassembler());
    }

    public RoundTripVerifier(Reassembler reassembler) {
        this.reassembler = reassembler;
    }

    /**
     * @throws RoundTripMismatchException at the first differing character
     */
    public void verify(String source, ConcreteSyntaxTree tree) {
        String actual = reassembler.reassemble(tree);
        if (actual.equals(source)) {
            logger.debug("Round trip of {} characters verified", source.length());
            return;
        }
        int offset = 0;
        int limit = Math.min(source.length(), actual.length());
        while (offset < limit && source.charAt(offset) == actual.charAt(offset)) {
            offset++;
        }
        LineMap lines = LineMap.of(source);
        throw new RoundTripMismatchException(tree.grammar(), offset, lines.line(offset), lines.column(offset),
                excerpt(source, offset), excerpt(actual, offset));
    }

    private static String excerpt(String text, int offset) {
        int end = Math.min(text.length(), offset + CONTEXT);
        return offset >= text.length() ? "<end of text>" : text.substring(offset, end).replace("\n", "\\n");
    }
}
