package org.blockgen;

/**
 * Raised when a registered handler hands back a fragment that does not fit the place the block
 * occupies, e.g. an expression from a block that has no output.
 */
public class BlockGenerationException extends BlockGenException {

    private final String blockType;

    public BlockGenerationException(String message, String blockType) {
        super(message);
        this.blockType = blockType;
    }

    public BlockGenerationException(String message, String blockType, Throwable cause) {
        super(message, cause);
        this.blockType = blockType;
    }

    public String getBlockType() {
        return blockType;
    }
}
