package com.raditha.canon.document;

import com.raditha.canon.patch.EditFailure;

import java.util.List;

/**
 * Result of {@link Document#tryApply}.
 *
 * @param document  the patched document, or the original one when nothing was committed
 * @param failures  edits that could not be applied
 * @param committed whether the successful edits were kept
 */
public record PatchOutcome(Document document, List<EditFailure> failures, boolean committed) {

    public PatchOutcome {
        failures = List.copyOf(failures);
    }

    public boolean isClean() {
        return committed && failures.isEmpty();
    }
}
