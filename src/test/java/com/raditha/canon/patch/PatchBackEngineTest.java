package com.raditha.canon.patch;

import com.raditha.canon.config.CanonConfig;
import com.raditha.canon.diff.Edit;
import com.raditha.canon.diff.FormatHint;
import com.raditha.canon.diff.Patch;
import com.raditha.canon.document.Document;
import com.raditha.canon.exceptions.AmbiguousInsertPositionException;
import com.raditha.canon.exceptions.InvalidEditException;
import com.raditha.canon.exceptions.StaleReferenceException;
import com.raditha.canon.format.FormatGrammar;
import com.raditha.canon.format.json.JsonGrammar;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.normalization.Normalizer;
import com.raditha.canon.normalization.RuleSet;
import com.raditha.canon.reassembly.Reassembler;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticTree;
import com.raditha.canon.semantic.SemanticValues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatchBackEngine.
 */
class PatchBackEngineTest {

    private final YamlGrammar yaml = new YamlGrammar();
    private final JsonGrammar json = new JsonGrammar();
    private final Reassembler reassembler = new Reassembler();

    private PatchBackEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PatchBackEngine();
    }

    private NodeId id(Document document, String path) {
        return document.tree().find(path).orElseThrow().id();
    }

    private SemanticNode value(Document document, Object plain) {
        return SemanticValues.of(document.lineage(), plain);
    }

    private String text(PatchResult result) {
        return reassembler.reassemble(result.tree());
    }

    private SemanticTree reread(PatchResult result, FormatGrammar grammar) {
        return new Normalizer(RuleSet.defaults()).normalize(result.tree(), grammar.profile()).tree();
    }

    @Test
    void testReplaceScalarKeepsComment() {
        Document doc = Document.parse("name: a  # keep\nother: 1\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(id(doc, "name"), value(doc, "b"))));

        assertTrue(result.isClean());
        assertEquals("name: b  # keep\nother: 1\n", text(result));
    }

    @Test
    void testReplaceRegistersNewValue() {
        Document doc = Document.parse("name: a\n", yaml);
        SemanticNode replacement = value(doc, "b");
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(id(doc, "name"), replacement)));

        assertTrue(result.map().lookupBySemanticId(replacement.id()).isPresent());
        assertNotSame(doc.cst(), result.tree());
        assertEquals("name: a\n", reassembler.reassemble(doc.cst()));
    }

    @Test
    void testReplaceKeepsSiblingStyles() {
        Document doc = Document.parse("a: 0x10\nb: 'x'\nc: 1.50\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(id(doc, "b"), value(doc, "y"))));

        assertEquals("a: 0x10\nb: 'y'\nc: 1.50\n", text(result));
    }

    @Test
    void testSyntheticInsertThenDeleteLeavesTextAlone() {
        String source = "apiVersion: tekton.dev/v1\nspec:\n  steps: []\n";
        Document doc = Document.parse(source, yaml, CanonConfig.tekton());
        PatchBackEngine tekton = new PatchBackEngine(doc.rules());
        SemanticNode kind = doc.tree().find("kind").orElseThrow();
        assertTrue(kind.isSynthetic());

        PatchResult result = tekton.applyPatch(doc.cst(), doc.map(), Patch.of(
                Edit.insertChild(doc.tree().root().id(), "kind", 2, value(doc, "Task")),
                Edit.deleteChild(doc.tree().root().id(), kind.id())));

        assertTrue(result.isClean());
        assertEquals(source, text(result));
    }

    @Test
    void testWritingSyntheticValueMaterializesIt() {
        Document doc = Document.parse("apiVersion: tekton.dev/v1\n", yaml, CanonConfig.tekton());
        PatchBackEngine tekton = new PatchBackEngine(doc.rules());
        NodeId kind = id(doc, "kind");

        PatchResult unchanged = tekton.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(kind, value(doc, "Task"))));
        assertEquals("apiVersion: tekton.dev/v1\n", text(unchanged));

        PatchResult written = tekton.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(kind, value(doc, "Pipeline"))));
        assertTrue(written.isClean());
        assertEquals("apiVersion: tekton.dev/v1\nkind: Pipeline\n", text(written));
    }

    @Test
    void testInsertIntoBlockMapping() {
        Document doc = Document.parse("a: 1\nb: 2\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(doc.tree().root().id(), "c", 2, value(doc, 3))));

        assertTrue(result.isClean());
        assertEquals("a: 1\nb: 2\nc: 3\n", text(result));
    }

    @Test
    void testInsertShiftsOrdinalsOfLaterSiblings() {
        Document doc = Document.parse("a: 1\nb: 2\n", yaml);
        SemanticNode z = value(doc, 0);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(doc.tree().root().id(), "z", 0, z)));

        assertTrue(result.isClean());
        assertEquals(0, result.map().lookupBySemanticId(z.id()).orElseThrow().ordinal());
        assertEquals(1, result.map().lookupBySemanticId(id(doc, "a")).orElseThrow().ordinal());
        assertEquals(2, result.map().lookupBySemanticId(id(doc, "b")).orElseThrow().ordinal());
        assertEquals(doc.map().size() + 1, result.map().size());
    }

    @Test
    void testAppendToBlockSequence() {
        Document doc = Document.parse("items:\n  - a\n  - b\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(id(doc, "items"), 2, value(doc, "c"))));

        assertTrue(result.isClean());
        assertEquals("items:\n  - a\n  - b\n  - c\n", text(result));
    }

    @Test
    void testInsertIntoJsonObject() {
        Document doc = Document.parse("{\"a\": 1, \"b\": 2}", json);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(doc.tree().root().id(), "c", 2, value(doc, 3))));

        assertTrue(result.isClean());
        assertEquals("{\"a\": 1, \"b\": 2, \"c\": 3}", text(result));
    }

    @Test
    void testDeleteFromJsonObject() {
        Document doc = Document.parse("{\"a\": 1, \"b\": 2}", json);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.deleteChild(doc.tree().root().id(), id(doc, "a"))));

        assertTrue(result.isClean());
        assertEquals("{\"b\": 2}", text(result));
    }

    @Test
    void testDeleteFromBlockMappingKeepsOtherComments() {
        String source = "# head\nkeep: 1  # stays\ndrop: 2\nlast: 3  # also stays\n";
        Document doc = Document.parse(source, yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.deleteChild(doc.tree().root().id(), id(doc, "drop"))));

        assertTrue(result.isClean());
        String patched = text(result);
        assertTrue(patched.startsWith("# head\nkeep: 1  # stays\n"), patched);
        assertTrue(patched.contains("last: 3  # also stays"), patched);
        assertFalse(patched.contains("drop"), patched);
        assertTrue(reread(result, yaml).semanticallyEquals(
                Document.parse("keep: 1\nlast: 3\n", yaml).tree()));
    }

    @Test
    void testMoveAndReorderSequenceItems() {
        Document doc = Document.parse("steps:\n  - lint\n  - build\n  - test\n", yaml);
        NodeId steps = id(doc, "steps");
        NodeId test = id(doc, "steps[2]");

        PatchResult moved = engine.applyPatch(doc.cst(), doc.map(), Patch.of(Edit.moveChild(steps, test, 0)));
        assertTrue(moved.isClean());
        assertTrue(reread(moved, yaml).semanticallyEquals(
                Document.parse("steps: [test, lint, build]\n", yaml).tree()));

        PatchResult reordered = engine.applyPatch(doc.cst(), doc.map(), Patch.of(Edit.reorderSiblings(steps,
                List.of(id(doc, "steps[1]"), id(doc, "steps[2]"), id(doc, "steps[0]")))));
        assertTrue(reordered.isClean());
        assertTrue(reread(reordered, yaml).semanticallyEquals(
                Document.parse("steps: [build, test, lint]\n", yaml).tree()));
    }

    @Test
    void testMoveOutOfRange() {
        Document doc = Document.parse("steps: [a, b]\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.moveChild(id(doc, "steps"), id(doc, "steps[0]"), 5)));

        assertFalse(result.committed());
        assertInstanceOf(InvalidEditException.class, result.failures().get(0).error());
    }

    @Test
    void testReorderWithRepeatedChild() {
        Document doc = Document.parse("steps: [a, b]\n", yaml);
        NodeId first = id(doc, "steps[0]");
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.reorderSiblings(id(doc, "steps"), List.of(first, first))));

        assertFalse(result.committed());
        assertInstanceOf(InvalidEditException.class, result.failures().get(0).error());
    }

    @Test
    void testInsertIntoEmptyCollectionNeedsHint() {
        Document doc = Document.parse("items: []\n", yaml);
        Edit edit = Edit.insertChild(id(doc, "items"), 0, value(doc, "x"));

        PatchResult refused = engine.applyPatch(doc.cst(), doc.map(), Patch.of(edit));
        assertFalse(refused.committed());
        assertInstanceOf(AmbiguousInsertPositionException.class, refused.failures().get(0).error());
        assertSame(doc.cst(), refused.tree());

        PatchResult hinted = engine.applyPatch(doc.cst(), doc.map(), Patch.of(edit.withHint(FormatHint.flow())));
        assertTrue(hinted.isClean());
        assertTrue(reread(hinted, yaml).semanticallyEquals(Document.parse("items: [x]\n", yaml).tree()));
    }

    @Test
    void testInsertIntoEmptyCollectionWithProfileHints() {
        Document doc = Document.parse("items: []\n", yaml);
        PatchBackEngine lenient = new PatchBackEngine(RuleSet.defaults(), null, true);
        PatchResult result = lenient.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(id(doc, "items"), 0, value(doc, "x"))));

        assertTrue(result.isClean());
        assertTrue(reread(result, yaml).semanticallyEquals(Document.parse("items: [x]\n", yaml).tree()));
    }

    @Test
    void testInsertExistingKey() {
        Document doc = Document.parse("a: 1\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(doc.tree().root().id(), "a", 1, value(doc, 2))));

        assertFalse(result.committed());
        EditFailure failure = result.failures().get(0);
        assertEquals(0, failure.index());
        assertInstanceOf(InvalidEditException.class, failure.error());
        assertTrue(failure.error().getMessage().contains("already exists"));
    }

    @Test
    void testUnknownIdIsStale() {
        Document doc = Document.parse("a: 1\n", yaml);
        NodeId unknown = NodeId.fresh(doc.lineage());
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(unknown, value(doc, 2))));

        assertFalse(result.committed());
        assertInstanceOf(StaleReferenceException.class, result.failures().get(0).error());
    }

    @Test
    void testEntryRemovedByEarlierEditIsStale() {
        Document doc = Document.parse("a:\n  b: 1\nc: 2\n", yaml);
        Patch patch = Patch.of(
                Edit.deleteChild(doc.tree().root().id(), id(doc, "a")),
                Edit.replaceValue(id(doc, "a.b"), value(doc, 5)));

        PatchResult result = engine.applyPatch(doc.cst(), doc.map(), patch);

        assertFalse(result.committed());
        EditFailure failure = result.failures().get(0);
        assertEquals(1, failure.index());
        assertInstanceOf(StaleReferenceException.class, failure.error());
        assertEquals("a:\n  b: 1\nc: 2\n", text(result));
    }

    @Test
    void testCrlfInsertsUseDocumentLineBreak() {
        Document mapping = Document.parse("a: 1\r\nb: 2\r\n", yaml);
        PatchResult inserted = engine.applyPatch(mapping.cst(), mapping.map(),
                Patch.of(Edit.insertChild(mapping.tree().root().id(), "c", 2, value(mapping, 3))));
        assertEquals("a: 1\r\nb: 2\r\nc: 3\r\n", text(inserted));

        Document sequence = Document.parse("items:\r\n  - a\r\n  - b\r\n", yaml);
        PatchResult appended = engine.applyPatch(sequence.cst(), sequence.map(),
                Patch.of(Edit.insertChild(id(sequence, "items"), 2, value(sequence, "c"))));
        assertEquals("items:\r\n  - a\r\n  - b\r\n  - c\r\n", text(appended));

        Document scalar = Document.parse("a: 1\r\n", yaml);
        PatchResult nested = engine.applyPatch(scalar.cst(), scalar.map(),
                Patch.of(Edit.replaceValue(id(scalar, "a"), value(scalar, Map.of("x", 1)))));
        assertEquals("a:\r\n  x: 1\r\n", text(nested));
    }

    @Test
    void testCrlfDeletes() {
        Document doc = Document.parse("a: 1\r\nb: 2\r\nc: 3\r\n", yaml);
        PatchResult middle = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.deleteChild(doc.tree().root().id(), id(doc, "b"))));
        assertEquals("a: 1\r\nc: 3\r\n", text(middle));

        Document unterminated = Document.parse("a: 1\r\nb: 2", yaml);
        PatchResult last = engine.applyPatch(unterminated.cst(), unterminated.map(),
                Patch.of(Edit.deleteChild(unterminated.tree().root().id(), id(unterminated, "b"))));
        assertEquals("a: 1", text(last));
    }

    @Test
    void testAllOrNothingRollsBackEarlierEdits() {
        Document doc = Document.parse("a: 1\nb: 2\n", yaml);
        Patch patch = Patch.of(
                Edit.replaceValue(id(doc, "a"), value(doc, 10)),
                Edit.replaceValue(NodeId.fresh(doc.lineage()), value(doc, 20)));

        PatchResult result = engine.applyPatch(doc.cst(), doc.map(), patch, TransactionMode.ALL_OR_NOTHING);

        assertFalse(result.committed());
        assertEquals(1, result.failures().size());
        assertEquals(1, result.failures().get(0).index());
        assertEquals("a: 1\nb: 2\n", text(result));
    }

    @Test
    void testBestEffortKeepsSucceedingEdits() {
        Document doc = Document.parse("a: 1\nb: 2\n", yaml);
        Patch patch = Patch.of(
                Edit.replaceValue(NodeId.fresh(doc.lineage()), value(doc, 20)),
                Edit.replaceValue(id(doc, "b"), value(doc, 3)));

        PatchResult result = engine.applyPatch(doc.cst(), doc.map(), patch, TransactionMode.BEST_EFFORT);

        assertTrue(result.committed());
        assertFalse(result.isClean());
        assertEquals(1, result.failures().size());
        assertEquals(0, result.failures().get(0).index());
        assertEquals("a: 1\nb: 3\n", text(result));
    }

    @Test
    void testContainerEditOnScalar() {
        Document doc = Document.parse("a: 1\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(id(doc, "a"), 0, value(doc, 2))));

        assertFalse(result.committed());
        assertInstanceOf(InvalidEditException.class, result.failures().get(0).error());
    }

    @Test
    void testLineageMismatch() {
        Document first = Document.parse("a: 1\n", yaml);
        Document second = Document.parse("a: 1\n", yaml);

        assertThrows(IllegalArgumentException.class,
                () -> engine.applyPatch(first.cst(), second.map(), Patch.EMPTY));
    }

    @Test
    void testEmptyPatchIsClean() {
        Document doc = Document.parse("a: 1  # c\n", yaml);
        PatchResult result = engine.applyPatch(doc.cst(), doc.map(), Patch.EMPTY);

        assertTrue(result.isClean());
        assertEquals(doc.text(), text(result));
    }

    @Test
    void testTransactionModeFromString() {
        assertEquals(TransactionMode.ALL_OR_NOTHING, TransactionMode.fromString("all-or-nothing"));
        assertEquals(TransactionMode.ALL_OR_NOTHING, TransactionMode.fromString("ATOMIC"));
        assertEquals(TransactionMode.BEST_EFFORT, TransactionMode.fromString("best_effort"));
        assertThrows(IllegalArgumentException.class, () -> TransactionMode.fromString("sometimes"));
        assertThrows(IllegalArgumentException.class, () -> TransactionMode.fromString(null));
    }

    @Test
    void testEditsInsideJsonLiteralRewriteIt() {
        String source = "params:\n  - name: p\n    value: '[\"a\", \"b\"]'  # list\n";
        Document doc = Document.parse(source, yaml, CanonConfig.tekton());
        PatchBackEngine tekton = new PatchBackEngine(doc.rules());

        PatchResult replaced = tekton.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(id(doc, "params[0].value[1]"), value(doc, "c"))));
        assertTrue(replaced.isClean());
        assertEquals("params:\n  - name: p\n    value: '[\"a\",\"c\"]'  # list\n", text(replaced));

        PatchResult appended = tekton.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.insertChild(id(doc, "params[0].value"), -1, value(doc, "d"))));
        assertEquals("params:\n  - name: p\n    value: '[\"a\",\"b\",\"d\"]'  # list\n", text(appended));

        PatchResult same = tekton.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(id(doc, "params[0].value"), value(doc, List.of("a", "b")))));
        assertEquals(source, text(same));

        PatchResult object = tekton.applyPatch(doc.cst(), doc.map(),
                Patch.of(Edit.replaceValue(id(doc, "params[0].value"), value(doc, Map.of("k", 1)))));
        assertEquals("params:\n  - name: p\n    value: '{\"k\":1}'  # list\n", text(object));
    }

    @Test
    void testSeveralEditsInsideOneJsonLiteral() {
        Document doc = Document.parse("value: \"[1, 2, 3]\"\n", yaml, CanonConfig.tekton());
        PatchBackEngine tekton = new PatchBackEngine(doc.rules());
        NodeId list = id(doc, "value");
        NodeId first = id(doc, "value[0]");
        NodeId third = id(doc, "value[2]");

        SemanticNode thirty = value(doc, 30);

        PatchResult result = tekton.applyPatch(doc.cst(), doc.map(), Patch.of(
                Edit.deleteChild(list, first),
                Edit.replaceValue(third, thirty),
                Edit.moveChild(list, thirty.id(), 0)));

        assertTrue(result.isClean(), result.failures().toString());
        assertEquals("value: \"[30,2]\"\n", text(result));
        assertTrue(result.map().lookupBySemanticId(first).isEmpty());

        PatchResult stale = tekton.applyPatch(doc.cst(), doc.map(), Patch.of(
                Edit.deleteChild(list, first),
                Edit.replaceValue(first, value(doc, 10))));
        assertFalse(stale.committed());
        assertInstanceOf(StaleReferenceException.class, stale.failures().get(0).error());
    }
}
