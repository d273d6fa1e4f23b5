package org.blockgen.generator;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.blockgen.BlockGenerationException;
import org.blockgen.GeneratorOptions;
import org.blockgen.UnsupportedBlockException;
import org.blockgen.block.BlockNode;
import org.blockgen.block.Workspace;
import org.blockgen.emit.IndexExpressionBuilder;
import org.blockgen.emit.Order;
import org.blockgen.emit.PrecedenceResolver;
import org.blockgen.emit.StringLiteralEncoder;
import org.blockgen.naming.DeclarationTable;
import org.blockgen.naming.NameAllocator;
import org.blockgen.naming.NameType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one generation pass over one workspace: allocated names, collected declarations and the
 * handlers that emit individual blocks.
 * <p>
 * A session is created per pass and is never shared, so independent passes never see each other's
 * names. It is not thread-safe. Once {@link #finish(String)} has run, every further call fails with
 * {@link IllegalStateException}.
 */
public final class GenerationSession {

    private static final Logger log = LoggerFactory.getLogger(GenerationSession.class);

    /**
     * Stands for the final function name in code passed to {@link #provideFunction(String, List)}.
     */
    public static final String FUNCTION_NAME_PLACEHOLDER = "{leCUI8hutHZI4480Dc}";

    private final String language;
    private final Map<String, BlockHandler> handlers;
    private final GeneratorOptions options;
    private final Workspace workspace;
    private final NameAllocator names;
    private final StatementAssembler assembler;
    private final Map<String, String> functionNames = new HashMap<>();

    private boolean active;

    public GenerationSession(String language, Map<String, BlockHandler> handlers, GeneratorOptions options,
                             Set<String> reservedWords, Workspace workspace) {
        this.language = language;
        this.handlers = handlers;
        this.options = options;
        this.workspace = workspace;
        this.names = new NameAllocator(reservedWords);
        this.assembler = new StatementAssembler(options.commentWrap(), this::chainCode);
        start();
    }

    private void start() {
        initDefinitions();
        names.init(workspace);
        active = true;
        log.debug("Started {} generation pass", language);
    }

    private void initDefinitions() {
        functionNames.clear();
    }

    /**
     * Prepends the collected declarations to {@code code} and closes the session.
     */
    public String finish(String code) {
        checkActive();
        String result = names.finish(code);
        functionNames.clear();
        active = false;
        log.debug("Finished {} generation pass", language);
        return result;
    }

    public boolean isActive() {
        return active;
    }

    public Workspace workspace() {
        return workspace;
    }

    public GeneratorOptions options() {
        return options;
    }

    // ── Block traversal ───────────────────────────────────────────────────

    /**
     * Code for {@code block} and every statement chained after it.
     */
    public CodeFragment blockToCode(BlockNode block) {
        return blockToCode(block, false);
    }

    /**
     * @param thisOnly emit only {@code block}, without the statements that follow it
     */
    public CodeFragment blockToCode(BlockNode block, boolean thisOnly) {
        checkActive();
        if (block == null) {
            return CodeFragment.statement("");
        }
        if (!block.isEnabled()) {
            // Skip past this block to the next one.
            if (thisOnly) {
                return CodeFragment.statement("");
            }
            return CodeFragment.statement(block.nextStatement().map(this::chainCode).orElse(""));
        }

        BlockHandler handler = handlers.get(block.type());
        if (handler == null) {
            throw new UnsupportedBlockException(language, block.type());
        }
        CodeFragment fragment = handler.generate(block, this);
        if (fragment == null || fragment == CodeFragment.none()) {
            return CodeFragment.none();
        }
        if (fragment.isExpression()) {
            if (!block.hasOutput()) {
                throw new BlockGenerationException("Expecting string from statement block: " + block.type(),
                                                   block.type());
            }
            return CodeFragment.expression(assembler.assemble(block, fragment.code(), thisOnly), fragment.order());
        }

        String code = fragment.code();
        Optional<String> prefix = options.statementPrefix();
        if (prefix.isPresent()) {
            code = injectId(prefix.get(), block) + code;
        }
        Optional<String> suffix = options.statementSuffix();
        if (suffix.isPresent()) {
            code = code + injectId(suffix.get(), block);
        }
        return CodeFragment.statement(assembler.assemble(block, code, thisOnly));
    }

    /**
     * Code of the expression plugged into input {@code name}, parenthesized if it binds more loosely
     * than {@code outerOrder}; the empty string if nothing is connected.
     */
    public String valueToCode(BlockNode block, String name, Order outerOrder) {
        checkActive();
        Optional<BlockNode> target = block.inputTarget(name);
        if (target.isEmpty()) {
            return "";
        }
        CodeFragment fragment = blockToCode(target.get());
        if (fragment.isEmpty()) {
            return "";
        }
        if (!fragment.isExpression()) {
            throw new BlockGenerationException("Expecting tuple from value block: " + target.get().type(),
                                               target.get().type());
        }
        return PrecedenceResolver.wrap(fragment.code(), fragment.order(), outerOrder);
    }

    /**
     * Indented code of the statement chain in input {@code name}; the empty string if nothing is
     * connected.
     */
    public String statementToCode(BlockNode block, String name) {
        checkActive();
        Optional<BlockNode> target = block.inputTarget(name);
        if (target.isEmpty()) {
            return "";
        }
        CodeFragment fragment = blockToCode(target.get());
        if (fragment.isExpression()) {
            throw new BlockGenerationException("Expecting code from statement block: " + target.get().type(),
                                               target.get().type());
        }
        String code = fragment.code();
        return code.isEmpty() ? code : prefixLines(code, options.indent());
    }

    /**
     * Index taken from input {@code name}, shifted by {@code delta}, optionally negated and moved to
     * the workspace's index origin.
     */
    public String getAdjusted(BlockNode block, String name, int delta, boolean negate, Order order) {
        boolean oneBased = block.workspace().indexOriginIsOneBased();
        Order outerOrder = IndexExpressionBuilder.outerOrder(delta, negate, order, oneBased);
        String at = valueToCode(block, name, outerOrder);
        return IndexExpressionBuilder.adjust(at, delta, negate, order, oneBased);
    }

    public String getAdjusted(BlockNode block, String name) {
        return getAdjusted(block, name, 0, false, Order.NONE);
    }

    // ── Names and declarations ────────────────────────────────────────────

    public String variableName(String id) {
        return names.getName(id, NameType.VARIABLE);
    }

    public String developerVariableName(String name) {
        return names.getName(name, NameType.DEVELOPER_VARIABLE);
    }

    public String distinctName(String desiredName, NameType type) {
        return names.getDistinctName(desiredName, type);
    }

    /**
     * Declares a helper function once per pass and returns its name. Occurrences of
     * {@link #FUNCTION_NAME_PLACEHOLDER} in {@code lines} are replaced by that name and two-space
     * indentation is converted to the configured indent.
     */
    public String provideFunction(String desiredName, List<String> lines) {
        checkActive();
        DeclarationTable definitions = names.declarations();
        if (!definitions.contains(desiredName)) {
            String functionName = names.getDistinctName(desiredName, NameType.PROCEDURE);
            functionNames.put(desiredName, functionName);
            String codeText = String.join("\n", lines).strip().replace(FUNCTION_NAME_PLACEHOLDER, functionName);
            definitions.put(desiredName, reindent(codeText));
            log.debug("Provided helper function {} as {}", desiredName, functionName);
        }
        return functionNames.get(desiredName);
    }

    /**
     * The declaration collected under {@code key} so far in this pass.
     */
    public Optional<String> definition(String key) {
        return Optional.ofNullable(names.declarations().get(key));
    }

    // ── Text helpers ──────────────────────────────────────────────────────

    public String quote(String text) {
        return StringLiteralEncoder.quote(text);
    }

    public String multilineQuote(String text) {
        return StringLiteralEncoder.multilineQuote(text);
    }

    public String prefixLines(String text, String prefix) {
        return CommentFormatter.prefixLines(text, prefix);
    }

    public String allNestedComments(BlockNode block) {
        return assembler.allNestedComments(block);
    }

    /**
     * Top-level values that aren't plugged into anything need a trailing semicolon to be legal.
     */
    public String scrubNakedValue(String line) {
        return line + ";\n";
    }

    /**
     * Replaces {@code %1} in {@code template} with the quoted id of {@code block}.
     */
    public String injectId(String template, BlockNode block) {
        return template.replace("%1", "'" + block.id() + "'");
    }

    /**
     * Adds the infinite-loop trap and the statement prefix/suffix to a loop body.
     */
    public String addLoopTrap(String branch, BlockNode block) {
        Optional<String> trap = options.infiniteLoopTrap();
        if (trap.isPresent()) {
            branch = prefixLines(injectId(trap.get(), block), options.indent()) + branch;
        }
        Optional<String> suffix = options.statementSuffix();
        if (suffix.isPresent()) {
            branch = prefixLines(injectId(suffix.get(), block), options.indent()) + branch;
        }
        Optional<String> prefix = options.statementPrefix();
        if (prefix.isPresent()) {
            branch = branch + prefixLines(injectId(prefix.get(), block), options.indent());
        }
        return branch;
    }

    private String chainCode(BlockNode next) {
        return blockToCode(next).code();
    }

    private String reindent(String codeText) {
        String previous = null;
        while (!codeText.equals(previous)) {
            previous = codeText;
            codeText = codeText.replaceAll("(?m)^(( {2})*) {2}", "$1\u0000");
        }
        return codeText.replace("\u0000", options.indent());
    }

    private void checkActive() {
        if (!active) {
            throw new IllegalStateException("Generation session is not active");
        }
    }
}
