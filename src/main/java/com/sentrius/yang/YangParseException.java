package com.sentrius.yang;

/**
 * Thrown by the grammar engine when a document does not conform to the YANG
 * statement grammar.
 */
public class YangParseException extends Exception {
    private final int line;
    private final int column;

    public YangParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public YangParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
        this.column = 0;
    }

    /**
     * @return 1-based line of the offending input, or 0 when unknown
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
