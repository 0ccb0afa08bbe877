package com.raditha.canon.workflow;

import com.raditha.canon.config.CanonConfig;
import com.raditha.canon.diff.EditOp;
import com.raditha.canon.diff.Patch;
import com.raditha.canon.document.Document;
import com.raditha.canon.document.PatchOutcome;
import com.raditha.canon.exceptions.PatchRejectedException;
import com.raditha.canon.format.FormatGrammar;
import com.raditha.canon.patch.EditFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the round trip behind the command line: read the original and an edited canonical
 * view, find what changed between their meanings, and write only those changes into the original
 * text.
 */
public class ProjectionWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionWorkflow.class);

    private final CanonConfig config;

    public ProjectionWorkflow() {
        this(CanonConfig.defaults());
    }

    public ProjectionWorkflow(CanonConfig config) {
        this.config = config;
    }

    /**
     * Project edits when the original and the edited view share a format.
     */
    public Projection projectEdits(String originalText, String editedCanonicalText, FormatGrammar grammar) {
        return projectEdits(originalText, grammar, editedCanonicalText, grammar);
    }

    /**
     * Project the edits in {@code editedText} onto {@code originalText}.
     *
     * @param originalText   the text to patch
     * @param originalFormat grammar of the original
     * @param editedText     the edited canonical view, or any document meant to replace the original's content
     * @param editedFormat   grammar of the edited view
     * @return the patched document and the edits behind it
     * @throws com.raditha.canon.exceptions.PatchRejectedException when the configured mode is
     *         all-or-nothing and an edit fails
     */
    public Projection projectEdits(String originalText, FormatGrammar originalFormat, String editedText,
                                   FormatGrammar editedFormat) {
        Document original = Document.parse(originalText, originalFormat, config);
        Document edited = Document.parse(editedText, editedFormat, config);
        Patch patch = original.diff(edited.tree());
        logger.info("Projecting {} edits ({} replace, {} insert, {} delete, {} move, {} reorder)", patch.size(),
                patch.count(EditOp.REPLACE_VALUE), patch.count(EditOp.INSERT_CHILD),
                patch.count(EditOp.DELETE_CHILD), patch.count(EditOp.MOVE_CHILD),
                patch.count(EditOp.REORDER_SIBLINGS));

        PatchOutcome outcome = original.tryApply(patch);
        if (!outcome.committed()) {
            EditFailure failure = outcome.failures().get(0);
            throw new PatchRejectedException(failure.index(), failure.error());
        }
        if (!outcome.failures().isEmpty()) {
            logger.warn("{} of {} edits could not be applied", outcome.failures().size(), patch.size());
        }
        return new Projection(original, outcome.document(), patch, outcome.failures(), outcome.committed());
    }

    /**
     * Edits that turn the meaning of {@code left} into the meaning of {@code right}; empty when
     * the two documents are equivalent.
     */
    public Patch compare(String left, FormatGrammar leftFormat, String right, FormatGrammar rightFormat) {
        Document a = Document.parse(left, leftFormat, config);
        Document b = Document.parse(right, rightFormat, config);
        Patch patch = a.diff(b.tree());
        logger.debug("Compared documents: {} edits", patch.size());
        return patch;
    }
}
