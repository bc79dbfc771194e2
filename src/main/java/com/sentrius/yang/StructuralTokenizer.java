package com.sentrius.yang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits YANG text into logical lines and tracks brace nesting.
 *
 * <p>A logical line is one statement header ending in {@code ;} or {@code {}, or a
 * lone {@code }}. A header spread over several physical lines becomes a single
 * logical line numbered after the physical line it starts on. Comments are
 * dropped and braces inside quoted strings are not counted.
 */
public class StructuralTokenizer {

    public TokenizedDocument tokenize(String content) {
        String text = content != null ? content : "";
        List<LogicalLine> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        int physicalLine = 1;
        int startLine = 0;
        int depth = 0;
        char quote = 0;
        int quoteLine = 0;
        boolean pendingSpace = false;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);

            if (quote != 0) {
                current.append(c);
                if (c == '\\' && quote == '"' && i + 1 < text.length()) {
                    char escaped = text.charAt(i + 1);
                    current.append(escaped);
                    if (escaped == '\n') {
                        physicalLine++;
                    }
                    i += 2;
                    continue;
                }
                if (c == '\n') {
                    physicalLine++;
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }

            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                int stop = end < 0 ? text.length() : end + 2;
                for (int j = i; j < stop; j++) {
                    if (text.charAt(j) == '\n') {
                        physicalLine++;
                    }
                }
                i = stop;
                pendingSpace = current.length() > 0;
                continue;
            }

            switch (c) {
                case '\n':
                    physicalLine++;
                    pendingSpace = current.length() > 0;
                    break;
                case ' ':
                case '\t':
                case '\r':
                    pendingSpace = current.length() > 0;
                    break;
                case ';':
                    if (current.length() == 0) {
                        startLine = physicalLine;
                    }
                    current.append(c);
                    lines.add(new LogicalLine(startLine, current.toString(), 0, 0, depth));
                    current.setLength(0);
                    pendingSpace = false;
                    break;
                case '{':
                    if (current.length() == 0) {
                        startLine = physicalLine;
                    } else if (pendingSpace) {
                        current.append(' ');
                    }
                    current.append(c);
                    depth++;
                    lines.add(new LogicalLine(startLine, current.toString(), 1, 0, depth));
                    current.setLength(0);
                    pendingSpace = false;
                    break;
                case '}':
                    if (current.length() > 0) {
                        lines.add(new LogicalLine(startLine, current.toString(), 0, 0, depth));
                        current.setLength(0);
                    }
                    depth--;
                    lines.add(new LogicalLine(physicalLine, "}", 0, 1, depth));
                    pendingSpace = false;
                    break;
                default:
                    if (current.length() == 0) {
                        startLine = physicalLine;
                    } else if (pendingSpace) {
                        current.append(' ');
                    }
                    pendingSpace = false;
                    current.append(c);
                    if (c == '"' || c == '\'') {
                        quote = c;
                        quoteLine = physicalLine;
                    }
                    break;
            }
            i++;
        }

        if (current.length() > 0) {
            lines.add(new LogicalLine(startLine, current.toString(), 0, 0, depth));
        }

        return new TokenizedDocument(lines, depth, physicalLine, quote != 0 ? quoteLine : 0);
    }

    public static class LogicalLine {
        private final int lineNumber;
        private final String text;
        private final int openBraces;
        private final int closeBraces;
        private final int depthAfter;

        public LogicalLine(int lineNumber, String text, int openBraces, int closeBraces, int depthAfter) {
            this.lineNumber = lineNumber;
            this.text = text;
            this.openBraces = openBraces;
            this.closeBraces = closeBraces;
            this.depthAfter = depthAfter;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getText() {
            return text;
        }

        public int getOpenBraces() {
            return openBraces;
        }

        public int getCloseBraces() {
            return closeBraces;
        }

        public int getDepthAfter() {
            return depthAfter;
        }

        public boolean opensBlock() {
            return openBraces > 0;
        }

        @Override
        public String toString() {
            return lineNumber + ": " + text;
        }
    }

    public static class TokenizedDocument {
        private final List<LogicalLine> lines;
        private final int finalDepth;
        private final int physicalLineCount;
        private final int unterminatedStringLine;

        public TokenizedDocument(List<LogicalLine> lines, int finalDepth, int physicalLineCount,
                                 int unterminatedStringLine) {
            this.lines = Collections.unmodifiableList(lines);
            this.finalDepth = finalDepth;
            this.physicalLineCount = physicalLineCount;
            this.unterminatedStringLine = unterminatedStringLine;
        }

        public List<LogicalLine> getLines() {
            return lines;
        }

        public int getFinalDepth() {
            return finalDepth;
        }

        public int getPhysicalLineCount() {
            return physicalLineCount;
        }

        /**
         * @return line where a quoted string that never closes begins, or 0
         */
        public int getUnterminatedStringLine() {
            return unterminatedStringLine;
        }
    }
}
