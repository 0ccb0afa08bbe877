package com.raditha.canon.document;

import com.raditha.canon.config.CanonConfig;
import com.raditha.canon.correspondence.CorrespondenceMap;
import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.diff.DiffEngine;
import com.raditha.canon.diff.Patch;
import com.raditha.canon.exceptions.PatchRejectedException;
import com.raditha.canon.format.FormatGrammar;
import com.raditha.canon.format.SourceParser;
import com.raditha.canon.normalization.NormalizationResult;
import com.raditha.canon.normalization.Normalizer;
import com.raditha.canon.normalization.RuleSet;
import com.raditha.canon.patch.EditFailure;
import com.raditha.canon.patch.PatchBackEngine;
import com.raditha.canon.patch.PatchResult;
import com.raditha.canon.patch.TransactionMode;
import com.raditha.canon.reassembly.Reassembler;
import com.raditha.canon.reassembly.RoundTripVerifier;
import com.raditha.canon.semantic.SemanticEditor;
import com.raditha.canon.semantic.SemanticTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A parsed document: its text, syntax tree, canonical semantic tree and the correspondence map
 * between the two. Documents are immutable; applying a patch yields a new document of the same
 * lineage.
 */
public final class Document {

    private static final Logger logger = LoggerFactory.getLogger(Document.class);

    private static final SourceParser PARSER = new SourceParser();
    private static final Reassembler REASSEMBLER = new Reassembler();
    private static final RoundTripVerifier VERIFIER = new RoundTripVerifier(REASSEMBLER);
    private static final DiffEngine DIFF = new DiffEngine();

    private final String text;
    private final FormatGrammar grammar;
    private final CanonConfig config;
    private final RuleSet rules;
    private final ConcreteSyntaxTree cst;
    private final SemanticTree tree;
    private final CorrespondenceMap map;

    private Document(String text, FormatGrammar grammar, CanonConfig config, RuleSet rules, ConcreteSyntaxTree cst,
                     NormalizationResult normalized) {
        this.text = text;
        this.grammar = grammar;
        this.config = config;
        this.rules = rules;
        this.cst = cst;
        this.tree = normalized.tree();
        this.map = normalized.map();
    }

    public static Document parse(String text, FormatGrammar grammar) {
        return parse(text, grammar, CanonConfig.defaults());
    }

    /**
     * Parse and normalize a document.
     *
     * @throws com.raditha.canon.exceptions.ParseException on malformed text
     * @throws com.raditha.canon.exceptions.AmbiguousTimestampFormatException on a timestamp the
     *         configured patterns read differently
     * @throws com.raditha.canon.exceptions.RoundTripMismatchException if the parsed tree does not
     *         reproduce the text
     */
    public static Document parse(String text, FormatGrammar grammar, CanonConfig config) {
        ConcreteSyntaxTree cst = PARSER.parse(text, grammar);
        if (config.verifyRoundTrip()) {
            VERIFIER.verify(text, cst);
        }
        RuleSet rules = config.ruleSet();
        NormalizationResult normalized = new Normalizer(rules).normalize(cst, grammar.profile());
        logger.debug("Parsed {} document {} with {} semantic nodes", grammar.name(), cst.lineage(),
                normalized.tree().size());
        return new Document(text, grammar, config, rules, cst, normalized);
    }

    public String text() {
        return text;
    }

    public String lineage() {
        return cst.lineage();
    }

    public FormatGrammar grammar() {
        return grammar;
    }

    public CanonConfig config() {
        return config;
    }

    public RuleSet rules() {
        return rules;
    }

    public ConcreteSyntaxTree cst() {
        return cst;
    }

    public SemanticTree tree() {
        return tree;
    }

    public CorrespondenceMap map() {
        return map;
    }

    /**
     * Start editing the canonical view. Diff the result against {@link #tree()} to get a patch.
     */
    public SemanticEditor edit() {
        return tree.edit();
    }

    public Patch diff(SemanticTree edited) {
        return DIFF.diff(tree, edited);
    }

    /**
     * Apply a patch, all edits or none.
     *
     * @throws PatchRejectedException when an edit fails; this document is unaffected
     */
    public Document apply(Patch patch) {
        PatchOutcome outcome = apply(patch, TransactionMode.ALL_OR_NOTHING);
        if (!outcome.committed()) {
            EditFailure failure = outcome.failures().get(0);
            throw new PatchRejectedException(failure.index(), failure.error());
        }
        return outcome.document();
    }

    /**
     * Apply a patch in the configured transaction mode without throwing on failed edits.
     */
    public PatchOutcome tryApply(Patch patch) {
        return apply(patch, config.transactionMode());
    }

    /**
     * Diff {@code edited} against this document and apply the result.
     */
    public Document update(SemanticTree edited) {
        return apply(diff(edited));
    }

    private PatchOutcome apply(Patch patch, TransactionMode mode) {
        if (patch.isEmpty()) {
            return new PatchOutcome(this, List.of(), true);
        }
        PatchBackEngine engine = new PatchBackEngine(rules, config.orphanCommentPolicy(),
                config.allowUnhintedInsert());
        PatchResult result = engine.applyPatch(cst, map, patch, mode);
        if (!result.committed()) {
            return new PatchOutcome(this, result.failures(), false);
        }
        return new PatchOutcome(patched(result.tree()), result.failures(), true);
    }

    private Document patched(ConcreteSyntaxTree patchedTree) {
        String patchedText = REASSEMBLER.reassemble(patchedTree);
        NormalizationResult normalized = new Normalizer(rules).normalize(patchedTree, grammar.profile());
        if (config.verifyRoundTrip()) {
            verifyReadBack(patchedText, normalized.tree());
        }
        logger.info("Patched {}: {} -> {} characters", lineage(), text.length(), patchedText.length());
        return new Document(patchedText, grammar, config, rules, patchedTree, normalized);
    }

    /**
     * The patched text, parsed afresh, must mean what the patched tree means.
     */
    private void verifyReadBack(String patchedText, SemanticTree expected) {
        ConcreteSyntaxTree reparsed = PARSER.parse(patchedText, grammar);
        VERIFIER.verify(patchedText, reparsed);
        SemanticTree actual = new Normalizer(rules).normalize(reparsed, grammar.profile()).tree();
        if (!actual.semanticallyEquals(expected)) {
            throw new IllegalStateException("Patched " + grammar.name() + " text of " + lineage()
                    + " reads back as " + actual.root() + " instead of " + expected.root());
        }
    }

    @Override
    public String toString() {
        return "Document[" + grammar.name() + ", " + lineage() + ", " + text.length() + " chars]";
    }
}
