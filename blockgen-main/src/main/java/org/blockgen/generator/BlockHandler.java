package org.blockgen.generator;

import org.blockgen.block.BlockNode;

/**
 * Emits the code of one block type. Handlers call back into the session for the code of the
 * block's inputs.
 */
@FunctionalInterface
public interface BlockHandler {

    CodeFragment generate(BlockNode block, GenerationSession session);
}
