package com.sentrius.yang;

import com.sentrius.yang.StructuralTokenizer.LogicalLine;
import com.sentrius.yang.StructuralTokenizer.TokenizedDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StructuralTokenizerTest {

    private final StructuralTokenizer tokenizer = new StructuralTokenizer();

    private static List<String> texts(TokenizedDocument document) {
        return document.getLines().stream().map(LogicalLine::getText).collect(Collectors.toList());
    }

    @Test
    void testSplitsSingleLineDocumentIntoStatements() {
        TokenizedDocument document = tokenizer.tokenize(TestDocuments.SCENARIO_A);

        assertEquals(List.of(
            "module m {",
            "namespace \"urn:x\";",
            "prefix \"m\";",
            "container c {",
            "leaf l {",
            "type string;",
            "}",
            "}",
            "}"
        ), texts(document));
        assertEquals(0, document.getFinalDepth());
        assertEquals(1, document.getPhysicalLineCount());
    }

    @Test
    void testHeaderSpanningLinesKeepsStartLine() {
        String input = "module m\n" +
                       "{\n" +
                       "  container c\n" +
                       "  {\n" +
                       "  }\n" +
                       "}\n";

        TokenizedDocument document = tokenizer.tokenize(input);

        assertEquals(List.of("module m {", "container c {", "}", "}"), texts(document));
        assertEquals(1, document.getLines().get(0).getLineNumber());
        assertEquals(3, document.getLines().get(1).getLineNumber());
        assertEquals(5, document.getLines().get(2).getLineNumber());
        assertEquals(6, document.getLines().get(3).getLineNumber());
        assertEquals(7, document.getPhysicalLineCount());
    }

    @Test
    void testBracesInsideStringsAndCommentsAreIgnored() {
        String input = "module m {\n" +
                       "  // a comment with { braces\n" +
                       "  description \"uses } and { freely\";\n" +
                       "  /* block { comment\n" +
                       "     } */\n" +
                       "  pattern '[{]+';\n" +
                       "}";

        TokenizedDocument document = tokenizer.tokenize(input);

        assertEquals(0, document.getFinalDepth());
        assertEquals(List.of(
            "module m {",
            "description \"uses } and { freely\";",
            "pattern '[{]+';",
            "}"
        ), texts(document));
        assertEquals(6, document.getLines().get(2).getLineNumber());
        assertEquals(7, document.getLines().get(3).getLineNumber());
    }

    @Test
    void testTracksDepthPerLine() {
        TokenizedDocument document = tokenizer.tokenize("a {\nb {\nc;\n}\n");

        List<LogicalLine> lines = document.getLines();
        assertEquals(1, lines.get(0).getDepthAfter());
        assertEquals(2, lines.get(1).getDepthAfter());
        assertEquals(2, lines.get(2).getDepthAfter());
        assertEquals(1, lines.get(3).getDepthAfter());
        assertEquals(1, document.getFinalDepth());
        assertTrue(lines.get(0).opensBlock());
        assertEquals(1, lines.get(3).getCloseBraces());
    }

    @Test
    void testExtraClosingBracesGoNegative() {
        TokenizedDocument document = tokenizer.tokenize("module m {\n}\n}");

        assertEquals(-1, document.getFinalDepth());
    }

    @Test
    void testCollapsesWhitespaceOutsideQuotes() {
        TokenizedDocument document = tokenizer.tokenize("leaf \t  name   {\n  type   \"two  spaces\" ;\n}");

        assertEquals(List.of("leaf name {", "type \"two  spaces\";", "}"), texts(document));
    }

    @Test
    void testReportsUnterminatedString() {
        TokenizedDocument document = tokenizer.tokenize("module m {\n  description \"never closed;\n}\n");

        assertEquals(2, document.getUnterminatedStringLine());
        assertEquals(1, document.getFinalDepth());
    }

    @Test
    void testEmptyInput() {
        TokenizedDocument document = tokenizer.tokenize("");

        assertTrue(document.getLines().isEmpty());
        assertEquals(0, document.getFinalDepth());
        assertEquals(1, document.getPhysicalLineCount());
        assertEquals(0, document.getUnterminatedStringLine());
    }

    @Test
    void testNullInputIsTreatedAsEmpty() {
        TokenizedDocument document = tokenizer.tokenize(null);

        assertTrue(document.getLines().isEmpty());
    }

    @Test
    void testTrailingFragmentWithoutTerminator() {
        TokenizedDocument document = tokenizer.tokenize("module m {\n  leaf dangling");

        assertEquals(List.of("module m {", "leaf dangling"), texts(document));
        assertEquals(2, document.getLines().get(1).getLineNumber());
    }
}
