package org.blockgen.block;

import java.util.List;

/**
 * Read-only view of the editor workspace the generator translates.
 */
public interface Workspace {

    /**
     * Top-level blocks in emission order.
     */
    List<BlockNode> topBlocks();

    /**
     * Variables used internally by generated code and never shown to the author, in definition order.
     */
    List<VarIdentity> developerVariables();

    /**
     * Author variables that are referenced at least once somewhere in the workspace.
     */
    List<VarIdentity> usedVariables();

    boolean indexOriginIsOneBased();
}
