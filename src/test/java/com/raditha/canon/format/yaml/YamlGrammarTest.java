package com.raditha.canon.format.yaml;

import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.cst.CstKind;
import com.raditha.canon.cst.CstNode;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.exceptions.ParseException;
import com.raditha.canon.format.SourceParser;
import com.raditha.canon.reassembly.Reassembler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class YamlGrammarTest {

    private final SourceParser parser = new SourceParser();
    private final Reassembler reassembler = new Reassembler();

    private ConcreteSyntaxTree parse(String text) {
        return parser.parse(text, new YamlGrammar());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "\n\n",
            "# only a comment\n",
            "plain scalar",
            "a: 1\nb: two\n",
            "a: 1\r\nb: 2\r\n",
            "# head\n\nkey:   value    # tail\n\n# foot\n",
            "list:\n- a\n- b\n",
            "list:\n  - a\n  -   b\n  - - nested\n    - more\n",
            "map: {a: 1, b: [x, y], c: {}}\nseq: [ ]\n",
            "flow: [\n  1,\n  2,\n]\n",
            "quoted: 'it''s'\ndouble: \"tab\\there\"\n",
            "text: |\n  line one\n  line two\nnext: 1\n",
            "anchor: &x 1\nalias: *x\n",
            "---\na: 1\n",
            "multi: word scalar\n  continued here\n",
            "a:\n  b:\n    c: deep\n  d: back\n",
            "no newline at end: true"
    })
    void testRoundTripIsExact(String source) {
        assertEquals(source, reassembler.reassemble(parse(source)));
    }

    @Test
    void testMappingStructure() {
        ConcreteSyntaxTree tree = parse("a: 1\nb: 'two'\n");
        CstNode root = tree.root();

        assertEquals(CstKind.MAPPING, root.kind());
        assertEquals(2, root.slotCount());
        CstNode b = tree.node(root.children().get(3));
        assertEquals("'two'", b.literal());
        assertEquals(QuoteStyle.SINGLE, b.style().quote());
    }

    @Test
    void testCommentTrivia() {
        ConcreteSyntaxTree tree = parse("# head\na: 1 # tail\nb: 2\n");
        CstNode root = tree.root();
        CstNode one = tree.node(root.children().get(1));
        CstNode bKey = tree.node(root.children().get(2));

        assertEquals(" # tail\n", one.trailing().text());
        assertTrue(root.leading().hasComment("#"));
        assertEquals("", bKey.leading().text());
    }

    @Test
    void testFlowCollections() {
        ConcreteSyntaxTree tree = parse("[a, {b: c}]");
        CstNode root = tree.root();

        assertEquals(CstKind.SEQUENCE, root.kind());
        assertEquals("[", root.literal());
        assertEquals("]", root.closing());
        assertTrue(root.style().isFlow());
        assertEquals(CstKind.MAPPING, tree.node(root.children().get(1)).kind());
    }

    @Test
    void testUnsupportedConstructsAreOpaque() {
        ConcreteSyntaxTree tree = parse("text: |\n  keep\n  me\n");
        CstNode value = tree.node(tree.root().children().get(1));

        assertEquals(CstKind.OPAQUE, value.kind());
        assertTrue(value.literal().startsWith("|"));
    }

    @Test
    void testEmptyDocumentIsEmptyScalar() {
        ConcreteSyntaxTree tree = parse("");

        assertEquals(CstKind.SCALAR, tree.root().kind());
        assertEquals("", tree.root().literal());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a: [1, 2",
            "a: 'open\n",
            "a: 1\n\tb: 2\n",
            "? complex\n: key\n",
            "a: 1\nb: 2\n  c: 3\n",
            "@reserved\n"
    })
    void testMalformedInputIsRejected(String source) {
        ParseException e = assertThrows(ParseException.class, () -> parse(source));
        assertTrue(e.getLocation().hasPosition(), "Parse errors carry a line and column");
    }
}
