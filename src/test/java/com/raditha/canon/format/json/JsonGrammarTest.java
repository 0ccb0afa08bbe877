package com.raditha.canon.format.json;

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

class JsonGrammarTest {

    private final SourceParser parser = new SourceParser();

    private ConcreteSyntaxTree parse(String text) {
        return parser.parse(text, new JsonGrammar());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{}",
            "[]",
            "  42  \n",
            "{\"a\": 1, \"b\": [true, false, null]}",
            "{\n  \"a\" :1 ,\n  \"b\":{ \"c\" : \"\\t\\n\" }\n}\n",
            "[1.5e10, -0.25, 0]",
            "\"just a string\""
    })
    void testRoundTripIsExact(String source) {
        assertEquals(source, new Reassembler().reassemble(parse(source)));
    }

    @Test
    void testSeparatorsAreTrivia() {
        ConcreteSyntaxTree tree = parse("{\"a\": 1, \"b\": 2}");
        CstNode root = tree.root();

        assertEquals(CstKind.MAPPING, root.kind());
        assertEquals("{", root.literal());
        assertEquals("}", root.closing());
        CstNode a = tree.node(root.children().get(0));
        CstNode one = tree.node(root.children().get(1));
        CstNode b = tree.node(root.children().get(2));
        assertEquals("\"a\"", a.literal());
        assertEquals(QuoteStyle.DOUBLE, a.style().quote());
        assertEquals(": ", one.leading().text());
        assertEquals(", ", b.leading().text());
    }

    @Test
    void testScalarLiteralsKeepTheirSpelling() {
        ConcreteSyntaxTree tree = parse("[1.50, \"x\\\"y\", true]");
        CstNode root = tree.root();

        assertEquals("1.50", tree.node(root.children().get(0)).literal());
        assertEquals("\"x\\\"y\"", tree.node(root.children().get(1)).literal());
        assertEquals(QuoteStyle.PLAIN, tree.node(root.children().get(2)).style().quote());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "{\"a\": }",
            "{\"a\": 1",
            "[1, 2,]",
            "{\"a\": 1} {\"b\": 2}",
            "{'a': 1}"
    })
    void testMalformedInputIsRejected(String source) {
        assertThrows(ParseException.class, () -> parse(source));
    }
}
