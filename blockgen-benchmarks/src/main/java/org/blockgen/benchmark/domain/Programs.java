package org.blockgen.benchmark.domain;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds synthetic workspaces of a given size: each statement assigns a nested arithmetic expression,
 * reads a list element and runs a small loop.
 */
public final class Programs {

    private Programs() {}

    public static ProgramWorkspace generate(int statements, boolean oneBased) {
        ThreadLocalRandom rng = ThreadLocalRandom.current();
        ProgramWorkspace workspace = new ProgramWorkspace(oneBased)
                .addVariable("list", "xs")
                .addVariable("total", "total");
        int ids = 0;

        ProgramBlock head = null;
        ProgramBlock tail = null;
        for (int i = 0; i < statements; i++) {
            String variableId = "v" + i;
            workspace.addVariable(variableId, "value " + i);

            ProgramBlock sum = arithmetic("ADD", "b" + ids++,
                                          number("b" + ids++, rng.nextInt(100)),
                                          arithmetic("MULTIPLY", "b" + ids++,
                                                     get("b" + ids++, "total"),
                                                     number("b" + ids++, rng.nextInt(10))));
            ProgramBlock element = new ProgramBlock("lists_getIndex", "b" + ids++, true)
                    .setValue("VALUE", get("b" + ids++, "list"))
                    .setValue("AT", get("b" + ids++, variableId));
            ProgramBlock assign = new ProgramBlock("variables_set", "b" + ids++, false)
                    .setField("VAR", variableId)
                    .setValue("VALUE", arithmetic("MULTIPLY", "b" + ids++, sum, element))
                    .setComment("Step " + i + " folds the running total into the next element of the list");
            ProgramBlock loop = new ProgramBlock("controls_repeat_ext", "b" + ids++, false)
                    .setValue("TIMES", number("b" + ids++, 3))
                    .setStatement("DO", new ProgramBlock("text_print", "b" + ids++, false)
                            .setValue("TEXT", get("b" + ids++, variableId)));
            assign.setNext(loop);

            if (head == null) {
                head = assign;
            } else {
                tail.setNext(assign);
            }
            tail = loop;
        }
        if (head != null) {
            workspace.addTopBlock(head);
        }
        return workspace;
    }

    private static ProgramBlock number(String id, int value) {
        return new ProgramBlock("math_number", id, true).setField("NUM", String.valueOf(value));
    }

    private static ProgramBlock get(String id, String variableId) {
        return new ProgramBlock("variables_get", id, true).setField("VAR", variableId);
    }

    private static ProgramBlock arithmetic(String op, String id, ProgramBlock a, ProgramBlock b) {
        return new ProgramBlock("math_arithmetic", id, true).setField("OP", op).setValue("A", a).setValue("B", b);
    }
}
