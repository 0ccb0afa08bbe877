package com.raditha.canon.cst;

import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.format.SourceParser;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.reassembly.Reassembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConcreteSyntaxTreeTest {

    private static final String SOURCE = "spec:\n  params:\n    - name: a\n";

    private ConcreteSyntaxTree tree;

    @BeforeEach
    void setUp() {
        tree = new SourceParser().parse(SOURCE, new YamlGrammar());
    }

    private CstNode nameValue() {
        CstNode spec = tree.node(tree.root().children().get(1));
        CstNode params = tree.node(spec.children().get(1));
        CstNode item = tree.node(params.children().get(0));
        return tree.node(item.children().get(1));
    }

    @Test
    void testNavigation() {
        CstNode value = nameValue();
        assertEquals("a", value.literal());
        assertEquals(CstKind.SCALAR, value.kind());

        CstNode item = tree.parent(value.id()).orElseThrow();
        assertEquals(CstKind.MAPPING, item.kind());
        assertEquals(1, tree.siblingIndex(value.id()));
        assertEquals(List.of(item.children().get(0), value.id()),
                tree.children(item.id()).stream().map(CstNode::id).toList());
        assertTrue(tree.parent(tree.rootId()).isEmpty());
    }

    @Test
    void testPathAndLocation() {
        CstNode value = nameValue();
        assertEquals("$.spec.params[0].name", tree.pathOf(value.id()));

        SourceLocation location = tree.locate(value.id());
        assertEquals("$.spec.params[0].name", location.path());
        assertEquals(3, location.line());
        assertEquals(13, location.column());
        assertEquals("$", tree.pathOf(tree.rootId()));
    }

    @Test
    void testSubtreeIsInDocumentOrder() {
        List<Integer> subtree = tree.subtree(tree.rootId());
        assertEquals(tree.size(), subtree.size());
        assertEquals(tree.rootId(), subtree.get(0));
        assertEquals(nameValue().id(), subtree.get(subtree.size() - 1));
    }

    @Test
    void testWorkingCopyLeavesOriginalUntouched() {
        CstNode value = nameValue();
        CstWorkingCopy copy = tree.edit();
        copy.put(value.withLiteral("b"));

        ConcreteSyntaxTree edited = copy.freeze();

        Reassembler reassembler = new Reassembler();
        assertEquals(SOURCE, reassembler.reassemble(tree));
        assertEquals("spec:\n  params:\n    - name: b\n", reassembler.reassemble(edited));
        assertEquals(tree.lineage(), edited.lineage());
    }

    @Test
    void testFrozenCopySharesUnchangedNodes() {
        CstNode value = nameValue();
        CstWorkingCopy copy = tree.edit();
        copy.put(value.withLiteral("b"));
        int spec = tree.root().children().get(1);

        ConcreteSyntaxTree edited = copy.freeze();

        assertSame(tree.node(spec), edited.node(spec));
        assertSame(tree.root(), edited.root());
        assertEquals(tree.size(), edited.size());
        assertEquals(Set.of(value.id()), copy.changedIds());

        CstWorkingCopy pruning = edited.edit();
        CstNode item = edited.parent(value.id()).orElseThrow();
        pruning.removeSubtree(item.id());
        ConcreteSyntaxTree pruned = pruning.freeze();
        assertFalse(pruned.contains(value.id()));
        assertEquals(tree.size() - 3, pruned.size());
        assertTrue(edited.contains(value.id()));
    }

    @Test
    void testLineBreakOfSource() {
        assertEquals("\n", tree.lineBreak());
        ConcreteSyntaxTree crlf = new SourceParser().parse("a: 1\r\nb: 2\r\n", new YamlGrammar());
        assertEquals("\r\n", crlf.lineBreak());
        assertEquals("\r\n", crlf.edit().lineBreak());
    }

    @Test
    void testWorkingCopyRollback() {
        CstNode value = nameValue();
        CstWorkingCopy copy = tree.edit();
        copy.put(value.withLiteral("b"));
        int mark = copy.checkpoint();
        int fresh = copy.allocateId();
        copy.put(CstNode.scalar(fresh, CstNode.NO_PARENT, "x", NodeStyle.PLAIN, null));
        copy.put(value.withLiteral("c"));

        copy.rollback(mark);

        assertEquals("b", copy.node(value.id()).literal());
        assertFalse(copy.contains(fresh));
        assertEquals(fresh, copy.allocateId(), "Rolled back ids are handed out again");
    }

    @Test
    void testUnknownNode() {
        assertThrows(IllegalArgumentException.class, () -> tree.node(10_000));
    }
}
