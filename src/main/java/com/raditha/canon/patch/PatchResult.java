package com.raditha.canon.patch;

import com.raditha.canon.correspondence.CorrespondenceMap;
import com.raditha.canon.cst.ConcreteSyntaxTree;

import java.util.List;

/**
 * Outcome of applying a patch.
 *
 * @param tree      the patched tree, or the original one when the patch was rejected
 * @param map       correspondence map matching {@code tree}
 * @param failures  edits that could not be applied
 * @param committed whether the edits that succeeded were kept
 */
public record PatchResult(ConcreteSyntaxTree tree, CorrespondenceMap map, List<EditFailure> failures,
                          boolean committed) {

    public PatchResult {
        failures = List.copyOf(failures);
    }

    static PatchResult rejected(ConcreteSyntaxTree original, CorrespondenceMap map, List<EditFailure> failures) {
        return new PatchResult(original, map, failures, false);
    }

    /**
     * Whether every edit was applied.
     */
    public boolean isClean() {
        return committed && failures.isEmpty();
    }
}
