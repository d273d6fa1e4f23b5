package org.blockgen;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Settings of a {@link WebPplGenerator}. Immutable; create one through {@link #builder()}.
 * <p>
 * {@link #defaults()} reads the system properties {@code blockgen.commentWrap} and
 * {@code blockgen.indent}.
 */
public final class GeneratorOptions {

    public static final int DEFAULT_COMMENT_WRAP = 60;
    public static final String DEFAULT_INDENT = "  ";

    private final int commentWrap;
    private final String indent;
    private final String infiniteLoopTrap;
    private final String statementPrefix;
    private final String statementSuffix;
    private final Set<String> reservedWords;

    private GeneratorOptions(Builder builder) {
        this.commentWrap = builder.commentWrap;
        this.indent = builder.indent;
        this.infiniteLoopTrap = builder.infiniteLoopTrap;
        this.statementPrefix = builder.statementPrefix;
        this.statementSuffix = builder.statementSuffix;
        this.reservedWords = Set.copyOf(builder.reservedWords);
    }

    public static GeneratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder()
                .commentWrap(Integer.getInteger("blockgen.commentWrap", DEFAULT_COMMENT_WRAP))
                .indent(System.getProperty("blockgen.indent", DEFAULT_INDENT));
    }

    /**
     * Column at which block comments wrap, comment marker included.
     */
    public int commentWrap() {
        return commentWrap;
    }

    public String indent() {
        return indent;
    }

    /**
     * Code inserted at the top of every loop body; {@code %1} stands for the quoted block id.
     */
    public Optional<String> infiniteLoopTrap() {
        return Optional.ofNullable(infiniteLoopTrap);
    }

    /**
     * Code emitted before every statement; {@code %1} stands for the quoted block id.
     */
    public Optional<String> statementPrefix() {
        return Optional.ofNullable(statementPrefix);
    }

    /**
     * Code emitted after every statement; {@code %1} stands for the quoted block id.
     */
    public Optional<String> statementSuffix() {
        return Optional.ofNullable(statementSuffix);
    }

    /**
     * Words reserved on top of the built-in WebPPL list.
     */
    public Set<String> reservedWords() {
        return reservedWords;
    }

    public static final class Builder {

        private int commentWrap = DEFAULT_COMMENT_WRAP;
        private String indent = DEFAULT_INDENT;
        private String infiniteLoopTrap;
        private String statementPrefix;
        private String statementSuffix;
        private final Set<String> reservedWords = new LinkedHashSet<>();

        private Builder() {}

        public Builder commentWrap(int commentWrap) {
            if (commentWrap <= 3) {
                throw new IllegalArgumentException("Comment wrap must leave room for the comment marker: " + commentWrap);
            }
            this.commentWrap = commentWrap;
            return this;
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder infiniteLoopTrap(String infiniteLoopTrap) {
            this.infiniteLoopTrap = infiniteLoopTrap;
            return this;
        }

        public Builder statementPrefix(String statementPrefix) {
            this.statementPrefix = statementPrefix;
            return this;
        }

        public Builder statementSuffix(String statementSuffix) {
            this.statementSuffix = statementSuffix;
            return this;
        }

        public Builder reservedWords(Collection<String> words) {
            this.reservedWords.addAll(words);
            return this;
        }

        public Builder reservedWords(String... words) {
            return reservedWords(Arrays.asList(words));
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(this);
        }
    }
}
