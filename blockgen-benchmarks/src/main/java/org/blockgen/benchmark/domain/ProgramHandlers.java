package org.blockgen.benchmark.domain;

import java.util.Map;

import org.blockgen.GeneratorOptions;
import org.blockgen.WebPplGenerator;
import org.blockgen.block.BlockNode;
import org.blockgen.emit.Order;
import org.blockgen.generator.CodeFragment;
import org.blockgen.generator.GenerationSession;
import org.blockgen.naming.NameType;

/**
 * Handlers for the block types {@link Programs} builds.
 */
public final class ProgramHandlers {

    private ProgramHandlers() {}

    public static WebPplGenerator generator(GeneratorOptions options) {
        return WebPplGenerator.builder()
                .options(options)
                .handlers(Map.of(
                        "math_number", (block, session) ->
                                CodeFragment.expression(field(block, "NUM"), Order.ATOMIC),
                        "text", (block, session) ->
                                CodeFragment.expression(session.quote(field(block, "TEXT")), Order.ATOMIC),
                        "variables_get", (block, session) ->
                                CodeFragment.expression(session.variableName(field(block, "VAR")), Order.ATOMIC),
                        "variables_set", ProgramHandlers::assignment,
                        "math_arithmetic", ProgramHandlers::arithmetic,
                        "lists_getIndex", ProgramHandlers::getIndex,
                        "text_print", ProgramHandlers::print,
                        "controls_repeat_ext", ProgramHandlers::repeat))
                .build();
    }

    private static String field(BlockNode block, String name) {
        return block.fieldValue(name).orElse("");
    }

    private static CodeFragment assignment(BlockNode block, GenerationSession session) {
        String value = session.valueToCode(block, "VALUE", Order.ASSIGNMENT);
        return CodeFragment.statement(session.variableName(field(block, "VAR")) + " = "
                                      + (value.isEmpty() ? "0" : value) + ";\n");
    }

    private static CodeFragment arithmetic(BlockNode block, GenerationSession session) {
        boolean add = "ADD".equals(field(block, "OP"));
        Order order = add ? Order.ADDITION : Order.MULTIPLICATION;
        String a = session.valueToCode(block, "A", order);
        String b = session.valueToCode(block, "B", order);
        return CodeFragment.expression(a + (add ? " + " : " * ") + b, order);
    }

    private static CodeFragment getIndex(BlockNode block, GenerationSession session) {
        String list = session.valueToCode(block, "VALUE", Order.MEMBER);
        return CodeFragment.expression(list + "[" + session.getAdjusted(block, "AT") + "]", Order.MEMBER);
    }

    private static CodeFragment print(BlockNode block, GenerationSession session) {
        return CodeFragment.statement("display(" + session.valueToCode(block, "TEXT", Order.NONE) + ");\n");
    }

    private static CodeFragment repeat(BlockNode block, GenerationSession session) {
        String times = session.valueToCode(block, "TIMES", Order.ASSIGNMENT);
        String branch = session.addLoopTrap(session.statementToCode(block, "DO"), block);
        String counter = session.distinctName("count", NameType.VARIABLE);
        return CodeFragment.statement("for (var " + counter + " = 0; " + counter + " < " + times + "; "
                                      + counter + "++) {\n" + branch + "}\n");
    }
}
