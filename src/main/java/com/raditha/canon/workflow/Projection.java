package com.raditha.canon.workflow;

import com.raditha.canon.diff.Patch;
import com.raditha.canon.document.Document;
import com.raditha.canon.patch.EditFailure;

import java.util.List;

/**
 * Results of projecting canonical edits onto an original document.
 *
 * @param original  the document the edits were projected onto
 * @param patched   the resulting document; {@code original} when nothing was committed
 * @param patch     the edits found between the canonical views
 * @param failures  edits that could not be applied
 * @param committed whether the edits that succeeded were kept
 */
public record Projection(Document original, Document patched, Patch patch, List<EditFailure> failures,
                         boolean committed) {

    public Projection {
        failures = List.copyOf(failures);
    }

    public String text() {
        return patched.text();
    }

    public boolean hasChanges() {
        return !original.text().equals(patched.text());
    }
}
