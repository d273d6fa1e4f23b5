package org.blockgen.generator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommentFormatterTest {

    @Test
    void wrap_leavesShortLinesAlone() {
        assertThat(CommentFormatter.wrap("short", 10)).isEqualTo("short");
        assertThat(CommentFormatter.wrap("aa bb", 5)).isEqualTo("aa bb");
    }

    @Test
    void wrap_breaksBetweenWords() {
        assertThat(CommentFormatter.wrap("aa bb cc", 5)).isEqualTo("aa bb\ncc");
        assertThat(CommentFormatter.wrap("aa  bb   cc dd", 5)).isEqualTo("aa bb\ncc dd");
    }

    @Test
    void wrap_keepsParagraphs() {
        assertThat(CommentFormatter.wrap("aa bb cc\ndd", 5)).isEqualTo("aa bb\ncc\ndd");
        assertThat(CommentFormatter.wrap("a\n\nb", 5)).isEqualTo("a\n\nb");
    }

    @Test
    void wrap_putsLongWordsOnTheirOwnLine() {
        assertThat(CommentFormatter.wrap("abcdefgh ij", 4)).isEqualTo("abcdefgh\nij");
    }

    @Test
    void prefixLines_prefixesEveryLine() {
        assertThat(CommentFormatter.prefixLines("a\nb", "// ")).isEqualTo("// a\n// b");
        assertThat(CommentFormatter.prefixLines("x = 1;\n", "  ")).isEqualTo("  x = 1;\n");
    }

    @Test
    void prefixLines_ignoresOnlyTheFinalNewline() {
        assertThat(CommentFormatter.prefixLines("a\nb\n", "// ")).isEqualTo("// a\n// b\n");
        assertThat(CommentFormatter.prefixLines("a\n\n", "// ")).isEqualTo("// a\n// \n");
        assertThat(CommentFormatter.prefixLines("", "// ")).isEqualTo("// ");
    }
}
