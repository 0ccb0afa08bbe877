package com.raditha.canon.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of edits. Applied in order; later edits see the effect of earlier ones.
 */
public record Patch(List<Edit> edits) {

    public static final Patch EMPTY = new Patch(List.of());

    public Patch {
        edits = List.copyOf(edits);
    }

    public static Patch of(Edit... edits) {
        return new Patch(List.of(edits));
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    public long count(EditOp op) {
        return edits.stream().filter(e -> e.op() == op).count();
    }

    public Patch append(Edit edit) {
        List<Edit> next = new ArrayList<>(edits);
        next.add(edit);
        return new Patch(next);
    }
}
