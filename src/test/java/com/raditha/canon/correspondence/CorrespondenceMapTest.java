package com.raditha.canon.correspondence;

import com.raditha.canon.config.CanonConfig;
import com.raditha.canon.cst.Span;
import com.raditha.canon.document.Document;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CorrespondenceMap.
 */
class CorrespondenceMapTest {

    private static final String TEXT = "a: 1\nlist: [x, y]\n";

    private Document doc;
    private CorrespondenceMap map;

    @BeforeEach
    void setUp() {
        doc = Document.parse(TEXT, new YamlGrammar());
        map = doc.map();
    }

    private CorrespondenceEntry entry(String path) {
        NodeId id = doc.tree().find(path).orElseThrow().id();
        return map.lookupBySemanticId(id).orElseThrow();
    }

    private static void collect(SemanticNode node, List<SemanticNode> out) {
        out.add(node);
        node.children().forEach(child -> collect(child, out));
    }

    @Test
    void testEveryNodeHasAnEntry() {
        List<SemanticNode> nodes = new ArrayList<>();
        collect(doc.tree().root(), nodes);

        assertEquals(nodes.size(), map.size());
        for (SemanticNode node : nodes) {
            assertTrue(map.lookupBySemanticId(node.id()).isPresent(), node.toString());
        }
        assertEquals(doc.lineage(), map.lineage());
    }

    @Test
    void testEntryDetails() {
        CorrespondenceEntry a = entry("a");

        assertEquals("a", a.key());
        assertEquals(SemanticPath.parse("a"), a.path());
        assertEquals(0, a.ordinal());
        assertEquals("1", TEXT.substring(a.span().start(), a.span().end()));
        assertEquals(doc.cst().rootId(), a.parentCstId());
        assertFalse(a.stale());
        assertFalse(a.isSynthetic());

        CorrespondenceEntry y = entry("list[1]");
        assertNull(y.key());
        assertEquals(1, y.ordinal());
        assertEquals("y", TEXT.substring(y.span().start(), y.span().end()));
    }

    @Test
    void testLookupBothWays() {
        CorrespondenceEntry list = entry("list");

        assertEquals(list, map.lookupByCstNode(list.cstNodeId()).orElseThrow());
        assertTrue(map.lookupByCstNode(-5).isEmpty());
    }

    @Test
    void testLookupByExactSpan() {
        CorrespondenceEntry list = entry("list");
        CorrespondenceEntry y = entry("list[1]");

        assertEquals(list, map.lookupByCstSpan(list.span()).orElseThrow());
        assertEquals(y, map.lookupByCstSpan(y.span()).orElseThrow());
        assertTrue(map.lookupByCstSpan(new Span(list.span().start(), list.span().end() - 1)).isEmpty());
    }

    @Test
    void testEntriesWithinSpanAreOutermostFirst() {
        CorrespondenceEntry list = entry("list");

        List<CorrespondenceEntry> inside = map.entriesWithin(list.span());

        assertEquals(List.of(list, entry("list[0]"), entry("list[1]")), inside);
        assertEquals(map.size(), map.entriesWithin(new Span(0, TEXT.length())).size());
    }

    @Test
    void testDerivedMapLeavesOriginalAlone() {
        CorrespondenceEntry a = entry("a");
        CorrespondenceMap derived = map.toBuilder().remove(a.semanticId()).build();

        assertEquals(map.size() - 1, derived.size());
        assertTrue(derived.lookupBySemanticId(a.semanticId()).isEmpty());
        assertTrue(derived.lookupByCstNode(a.cstNodeId()).isEmpty());
        assertTrue(derived.lookupByCstSpan(a.span()).isEmpty());
        assertEquals(a, map.lookupByCstSpan(a.span()).orElseThrow());
        assertSame(map, map.toBuilder().build());
    }

    @Test
    void testInvalidateMarksSubtreeStale() {
        CorrespondenceMap invalidated = map.invalidate(doc.cst(), entry("list").cstNodeId());

        for (String path : List.of("list", "list[0]", "list[1]")) {
            NodeId id = doc.tree().find(path).orElseThrow().id();
            assertTrue(invalidated.lookupBySemanticId(id).orElseThrow().stale(), path);
        }
        assertFalse(invalidated.lookupBySemanticId(entry("a").semanticId()).orElseThrow().stale());
        assertFalse(entry("list").stale());
    }

    @Test
    void testBuilderRollback() {
        CorrespondenceMap.Builder builder = map.toBuilder();
        CorrespondenceEntry a = entry("a");
        int mark = builder.checkpoint();

        builder.remove(a.semanticId());
        builder.put(entry("list").markStale());
        assertTrue(builder.get(a.semanticId()).isEmpty());

        builder.rollback(mark);

        CorrespondenceMap restored = builder.build();
        assertEquals(a, restored.lookupBySemanticId(a.semanticId()).orElseThrow());
        assertFalse(restored.lookupBySemanticId(entry("list").semanticId()).orElseThrow().stale());
    }

    @Test
    void testReindexKeepsEntries() {
        CorrespondenceMap reindexed = map.reindex(doc.cst());

        assertEquals(map.size(), reindexed.size());
        assertEquals(entry("list[1]"), reindexed.lookupBySemanticId(entry("list[1]").semanticId()).orElseThrow());
    }

    @Test
    void testSyntheticEntries() {
        Document task = Document.parse("spec:\n  steps: []\n", new YamlGrammar(), CanonConfig.tekton());
        SemanticNode kind = task.tree().find("kind").orElseThrow();

        CorrespondenceEntry entry = task.map().lookupBySemanticId(kind.id()).orElseThrow();

        assertTrue(kind.isSynthetic());
        assertTrue(entry.isSynthetic());
        assertEquals(CorrespondenceEntry.NO_NODE, entry.cstNodeId());
        assertEquals(task.cst().rootId(), entry.parentCstId());
        assertNull(entry.span());
        assertTrue(task.map().syntheticHostedBy(task.cst().rootId()).contains(entry));
        assertTrue(task.map().syntheticHostedBy(-5).isEmpty());
    }

    @Test
    void testEntryValidation() {
        NodeId id = NodeId.fresh(doc.lineage());
        SemanticPath path = SemanticPath.parse("a");

        assertThrows(IllegalArgumentException.class,
                () -> CorrespondenceEntry.backed(id, -1, 0, "a", path, null, 0, null));
        assertThrows(IllegalArgumentException.class,
                () -> new CorrespondenceEntry(id, 3, 0, "a", path, null, 0, null, false, true));
        assertThrows(IllegalArgumentException.class,
                () -> CorrespondenceEntry.backed(null, 1, 0, "a", path, null, 0, null));
    }

    @Test
    void testSyntaxNodeBackingTwoEntries() {
        CorrespondenceEntry a = entry("a");
        CorrespondenceMap.Builder builder = map.toBuilder()
                .put(CorrespondenceEntry.backed(NodeId.fresh(doc.lineage()), a.cstNodeId(), a.parentCstId(), "b",
                        SemanticPath.parse("b"), a.rule(), 1, a.span()));

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
