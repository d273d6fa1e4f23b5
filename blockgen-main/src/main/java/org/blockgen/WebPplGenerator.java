package org.blockgen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.blockgen.block.BlockNode;
import org.blockgen.block.Workspace;
import org.blockgen.generator.BlockHandler;
import org.blockgen.generator.GenerationSession;
import org.blockgen.naming.ReservedWords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates WebPPL source from a workspace of blocks.
 * <p>
 * A generator holds only immutable configuration. Every call to {@link #workspaceToCode(Workspace)}
 * runs in its own {@link GenerationSession}, so one generator may serve several workspaces at the
 * same time.
 *
 * <pre>{@code
 * WebPplGenerator generator = WebPplGenerator.builder()
 *         .handler("math_number", (block, session) -> CodeFragment.expression(..., Order.ATOMIC))
 *         .build();
 * String program = generator.workspaceToCode(workspace);
 * }</pre>
 */
public final class WebPplGenerator {

    private static final Logger log = LoggerFactory.getLogger(WebPplGenerator.class);

    public static final String LANGUAGE = "WebPPL";

    private final Map<String, BlockHandler> handlers;
    private final GeneratorOptions options;
    private final Set<String> reservedWords;

    private WebPplGenerator(Builder builder) {
        this.handlers = Map.copyOf(builder.handlers);
        this.options = builder.options;
        this.reservedWords = ReservedWords.webppl(options.reservedWords());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a pass over {@code workspace}. Callers that drive generation themselves must end it with
     * {@link GenerationSession#finish(String)}.
     */
    public GenerationSession openSession(Workspace workspace) {
        return new GenerationSession(LANGUAGE, handlers, options, reservedWords, workspace);
    }

    /**
     * The complete program: variable and helper declarations followed by the code of every top block.
     */
    public String workspaceToCode(Workspace workspace) {
        GenerationSession session = openSession(workspace);
        List<String> lines = new ArrayList<>();
        for (BlockNode block : workspace.topBlocks()) {
            String line = session.blockToCode(block).code();
            if (line.isEmpty()) {
                continue;
            }
            if (block.hasOutput()) {
                // This block is a naked value.
                line = session.scrubNakedValue(line);
                if (options.statementPrefix().isPresent()) {
                    line = session.injectId(options.statementPrefix().get(), block) + line;
                }
                if (options.statementSuffix().isPresent()) {
                    line = line + session.injectId(options.statementSuffix().get(), block);
                }
            }
            lines.add(line);
        }

        String code = session.finish(String.join("\n", lines));
        log.debug("Generated {} top-level block(s) into {} characters", lines.size(), code.length());
        return tidy(code);
    }

    public GeneratorOptions options() {
        return options;
    }

    public Set<String> reservedWords() {
        return reservedWords;
    }

    public boolean handles(String blockType) {
        return handlers.containsKey(blockType);
    }

    /**
     * Drops leading blank lines, collapses trailing whitespace into one newline and strips trailing
     * blanks from every line.
     */
    static String tidy(String code) {
        code = code.replaceFirst("^\\s+\n", "");
        code = code.replaceFirst("\n\\s+$", "\n");
        return code.replaceAll("[ \t]+\n", "\n");
    }

    public static final class Builder {

        private final Map<String, BlockHandler> handlers = new HashMap<>();
        private GeneratorOptions options = GeneratorOptions.defaults();

        private Builder() {}

        public Builder handler(String blockType, BlockHandler handler) {
            handlers.put(Objects.requireNonNull(blockType, "blockType"), Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder handlers(Map<String, BlockHandler> handlers) {
            handlers.forEach(this::handler);
            return this;
        }

        public Builder options(GeneratorOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public WebPplGenerator build() {
            return new WebPplGenerator(this);
        }
    }
}
