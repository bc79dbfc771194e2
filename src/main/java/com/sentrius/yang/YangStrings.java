package com.sentrius.yang;

/**
 * Quoted-string handling shared by both parsers.
 */
public final class YangStrings {

    private YangStrings() {
    }

    /**
     * Strips the quotes of a single- or double-quoted YANG string. Double-quoted
     * text is unescaped; single-quoted text is taken literally. Anything else is
     * returned unchanged.
     */
    public static String unquote(String token) {
        if (token == null || token.length() < 2) {
            return token;
        }
        if (token.startsWith("'") && token.endsWith("'")) {
            return token.substring(1, token.length() - 1);
        }
        if (token.startsWith("\"") && token.endsWith("\"")) {
            return unescape(token.substring(1, token.length() - 1));
        }
        return token;
    }

    /**
     * Resolves the escapes allowed inside a double-quoted string ({@code \n},
     * {@code \t}, {@code \"} and {@code \\}) in one left-to-right pass. Any other
     * backslash sequence is kept as written.
     */
    public static String unescape(String text) {
        if (text == null || text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 == text.length()) {
                out.append(c);
                continue;
            }
            char next = text.charAt(i + 1);
            switch (next) {
                case 'n':
                    out.append('\n');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case '"':
                    out.append('"');
                    break;
                case '\\':
                    out.append('\\');
                    break;
                default:
                    out.append(c).append(next);
                    break;
            }
            i++;
        }
        return out.toString();
    }
}
