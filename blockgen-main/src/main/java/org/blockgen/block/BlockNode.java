package org.blockgen.block;

import java.util.List;
import java.util.Optional;

/**
 * A single block of the visual program. Implementations are owned by the editor; the generator only
 * reads them.
 */
public interface BlockNode {

    /**
     * The block kind, used to look up the handler that emits this block.
     */
    String type();

    String id();

    /**
     * Whether the block has an output connection at all, i.e. it produces a value.
     */
    boolean hasOutput();

    /**
     * Whether the output connection is currently plugged into a parent expression.
     */
    boolean hasConnectedOutput();

    Optional<BlockNode> nextStatement();

    /**
     * Input slots in declaration order.
     */
    List<BlockInput> inputs();

    Optional<String> commentText();

    Workspace workspace();

    default boolean isEnabled() {
        return true;
    }

    default Optional<String> fieldValue(String name) {
        return Optional.empty();
    }

    default Optional<BlockInput> input(String name) {
        for (BlockInput input : inputs()) {
            if (input.name().equals(name)) {
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    default Optional<BlockNode> inputTarget(String name) {
        return input(name).flatMap(BlockInput::child);
    }
}
