package com.sentrius.yang;

import com.sentrius.yang.model.YangStatement;
import org.antlr.v4.runtime.*;

import java.util.List;

/**
 * Entry point of the grammar engine. Turns YANG text into a statement tree or
 * fails with the position of the first syntax error.
 */
public class YangStatementParser {

    public static List<YangStatement> parse(String input) throws YangParseException {
        try {
            CharStream charStream = CharStreams.fromString(input);
            YANGLexer lexer = new YANGLexer(charStream);
            lexer.removeErrorListeners();
            lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

            CommonTokenStream tokens = new CommonTokenStream(lexer);
            YANGParser parser = new YANGParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(ThrowingErrorListener.INSTANCE);

            YANGParser.DocumentContext documentContext = parser.document();

            YangStatementVisitor visitor = new YangStatementVisitor();
            return visitor.visitDocument(documentContext);
        } catch (SyntaxError e) {
            throw new YangParseException(e.getMessage(), e.line, e.column);
        } catch (RuntimeException e) {
            throw new YangParseException("Failed to parse YANG document: " + e.getMessage(), e);
        }
    }

    private static class ThrowingErrorListener extends BaseErrorListener {
        public static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                              int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new SyntaxError("Syntax error at line " + line + ":" + charPositionInLine + " - " + msg,
                line, charPositionInLine);
        }
    }

    private static class SyntaxError extends RuntimeException {
        private final int line;
        private final int column;

        SyntaxError(String message, int line, int column) {
            super(message);
            this.line = line;
            this.column = column;
        }
    }
}
