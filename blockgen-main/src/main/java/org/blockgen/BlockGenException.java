package org.blockgen;

/**
 * Root of every failure raised while turning blocks into WebPPL. Callers that only need to know that
 * generation failed can catch this type; the subclasses say which block was at fault and why.
 */
public class BlockGenException extends RuntimeException {

    public BlockGenException(String message) {
        super(message);
    }

    public BlockGenException(String message, Throwable cause) {
        super(message, cause);
    }

    public BlockGenException(Throwable cause) {
        super(cause);
    }
}
