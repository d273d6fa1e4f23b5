package org.blockgen.block;

import java.util.Objects;
import java.util.Optional;

/**
 * One input slot of a block. Only {@link InputKind#VALUE} slots hold expression children; statement
 * slots hold the head of a nested statement chain.
 */
public record BlockInput(String name, InputKind kind, BlockNode connectedChild) {

    public BlockInput {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static BlockInput value(String name, BlockNode child) {
        return new BlockInput(name, InputKind.VALUE, child);
    }

    public static BlockInput statement(String name, BlockNode child) {
        return new BlockInput(name, InputKind.STATEMENT, child);
    }

    public static BlockInput dummy(String name) {
        return new BlockInput(name, InputKind.DUMMY, null);
    }

    public boolean isValueSlot() {
        return kind == InputKind.VALUE;
    }

    public Optional<BlockNode> child() {
        return Optional.ofNullable(connectedChild);
    }
}
