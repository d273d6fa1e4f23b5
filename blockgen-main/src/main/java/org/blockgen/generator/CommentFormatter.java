package org.blockgen.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers for turning block comments into line comments.
 */
public final class CommentFormatter {

    public static final String LINE_COMMENT = "// ";

    private CommentFormatter() {}

    /**
     * Word-wraps every paragraph of {@code text} to at most {@code limit} columns. Words longer than
     * the limit are left on a line of their own.
     */
    public static String wrap(String text, int limit) {
        String[] paragraphs = text.split("\n", -1);
        List<String> wrapped = new ArrayList<>(paragraphs.length);
        for (String paragraph : paragraphs) {
            wrapped.add(wrapLine(paragraph, limit));
        }
        return String.join("\n", wrapped);
    }

    /**
     * Puts {@code prefix} in front of every line. A trailing newline does not start a new line.
     */
    public static String prefixLines(String text, String prefix) {
        StringBuilder out = new StringBuilder(text.length() + prefix.length());
        out.append(prefix);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            out.append(c);
            if (c == '\n' && i < text.length() - 1) {
                out.append(prefix);
            }
        }
        return out.toString();
    }

    private static String wrapLine(String line, int limit) {
        if (line.length() <= limit) {
            return line;
        }
        String[] words = line.trim().split("\\s+");
        StringBuilder out = new StringBuilder(line.length());
        int column = 0;
        for (String word : words) {
            if (column == 0) {
                out.append(word);
                column = word.length();
            } else if (column + 1 + word.length() <= limit) {
                out.append(' ').append(word);
                column += 1 + word.length();
            } else {
                out.append('\n').append(word);
                column = word.length();
            }
        }
        return out.toString();
    }
}
