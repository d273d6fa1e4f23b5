package org.blockgen.emit;

/**
 * Encodes text as single-quoted WebPPL string literals.
 */
public final class StringLiteralEncoder {

    private StringLiteralEncoder() {}

    /**
     * Escapes backslashes and quotes; a newline becomes a backslash line continuation.
     */
    public static String quote(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2);
        out.append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\\n");
                case '\'' -> out.append("\\'");
                default -> out.append(c);
            }
        }
        out.append('\'');
        return out.toString();
    }

    /**
     * Quotes each line on its own and joins them with a {@code '\n'} concatenation, so that the
     * runtime rebuilds the multi-line text.
     */
    public static String multilineQuote(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append(" + '\\n' +\n");
            }
            out.append(quote(lines[i]));
        }
        return out.toString();
    }
}
