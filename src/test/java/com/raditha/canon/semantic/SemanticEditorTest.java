package com.raditha.canon.semantic;

import com.raditha.canon.exceptions.InvalidEditException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SemanticEditorTest {

    private SemanticTree tree;

    @BeforeEach
    void setUp() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("name", "demo");
        root.put("steps", List.of("build", "test", "deploy"));
        root.put("meta", Map.of("owner", "ops"));
        tree = new SemanticTree("lineage", SemanticValues.of("lineage", root));
    }

    @Test
    void testSetKeepsIdOfReplacedNode() {
        NodeId before = tree.find("name").orElseThrow().id();

        SemanticTree edited = tree.edit().set("name", "prod").result();

        assertEquals("prod", edited.find("name").orElseThrow().value());
        assertEquals(before, edited.find("name").orElseThrow().id());
        assertEquals("demo", tree.find("name").orElseThrow().value(), "The original tree is immutable");
    }

    @Test
    void testSetAddsMissingKey() {
        SemanticTree edited = tree.edit().set("meta.tier", 3).result();

        assertEquals(BigInteger.valueOf(3), edited.find("meta.tier").orElseThrow().value());
    }

    @Test
    void testSequenceEdits() {
        NodeId deploy = tree.find("steps[2]").orElseThrow().id();

        SemanticTree edited = tree.edit()
                .insert("steps", 0, "lint")
                .append("steps", "notify")
                .delete("steps[2]")
                .move("steps", 2, 0)
                .result();

        List<Object> steps = new ArrayList<>();
        edited.find("steps").orElseThrow().items().forEach(i -> steps.add(i.value()));
        assertEquals(List.of("deploy", "lint", "build", "notify"), steps);
        assertEquals(deploy, edited.find("steps[0]").orElseThrow().id(), "Moved items keep their id");
    }

    @Test
    void testReorderKeys() {
        SemanticTree edited = tree.edit().reorderKeys("$", List.of("meta", "name")).result();

        assertEquals(List.of("meta", "name", "steps"), new ArrayList<>(edited.root().entries().keySet()));
        assertTrue(edited.semanticallyEquals(tree), "Mapping order is insignificant");
    }

    @Test
    void testDeleteMissingKey() {
        assertThrows(InvalidEditException.class, () -> tree.edit().delete("meta.nothing"));
        assertThrows(InvalidEditException.class, () -> tree.edit().delete("$"));
    }

    @Test
    void testWrongKindOrIndex() {
        assertThrows(InvalidEditException.class, () -> tree.edit().append("name", "x"));
        assertThrows(InvalidEditException.class, () -> tree.edit().insert("steps", 4, "x"));
        assertThrows(InvalidEditException.class, () -> tree.edit().move("steps", 0, 3));
        assertThrows(InvalidEditException.class, () -> tree.edit().set("nothing.here", 1));
    }

    @Test
    void testLookups() {
        SemanticNode owner = tree.find("meta.owner").orElseThrow();

        assertEquals("$.meta.owner", tree.pathOf(owner.id()).orElseThrow().toString());
        assertEquals("owner", tree.keyOf(owner.id()).orElseThrow());
        assertEquals(tree.find("meta").orElseThrow().id(), tree.parentOf(owner.id()).orElseThrow().id());
        assertEquals(8, tree.size());
    }

    @Test
    void testSemanticEquality() {
        NodeId a = new NodeId("x", "a");
        NodeId b = new NodeId("y", "b");

        assertEquals(SemanticValues.scalar(a, 1.5), SemanticValues.scalar(b, new java.math.BigDecimal("1.50")));
        assertNotEquals(SemanticValues.scalar(a, 1), SemanticValues.scalar(b, 1.0));
        assertNotEquals(SemanticValues.scalar(a, "1"), SemanticValues.scalar(b, 1));
        assertEquals(SemanticValues.deterministic(a, List.of(1, 2)), SemanticValues.of("z", List.of(1, 2)));
        assertNotEquals(SemanticValues.of("z", List.of(1, 2)), SemanticValues.of("z", List.of(2, 1)));
    }

    @Test
    void testPathParsing() {
        SemanticPath path = SemanticPath.parse("$.a['b.c'][2].d");

        assertEquals(4, path.depth());
        assertEquals("b.c", path.segments().get(1).key());
        assertEquals(2, path.segments().get(2).index());
        assertEquals("$.a['b.c'][2].d", path.toString());
        assertThrows(IllegalArgumentException.class, () -> SemanticPath.parse("a[x]"));
    }
}
