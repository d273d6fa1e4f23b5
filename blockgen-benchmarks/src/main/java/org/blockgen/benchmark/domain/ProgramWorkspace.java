package org.blockgen.benchmark.domain;

import java.util.ArrayList;
import java.util.List;

import org.blockgen.block.BlockNode;
import org.blockgen.block.VarIdentity;
import org.blockgen.block.Workspace;

public class ProgramWorkspace implements Workspace {

    private final List<BlockNode> topBlocks = new ArrayList<>();
    private final List<VarIdentity> variables = new ArrayList<>();
    private final boolean oneBased;

    public ProgramWorkspace(boolean oneBased) {
        this.oneBased = oneBased;
    }

    public ProgramWorkspace addTopBlock(ProgramBlock block) {
        block.setWorkspace(this);
        topBlocks.add(block);
        return this;
    }

    /**
     * Variables are reported as used as soon as they are declared.
     */
    public ProgramWorkspace addVariable(String id, String name) {
        variables.add(new VarIdentity(id, name));
        return this;
    }

    @Override
    public List<BlockNode> topBlocks() {
        return topBlocks;
    }

    @Override
    public List<VarIdentity> developerVariables() {
        return List.of();
    }

    @Override
    public List<VarIdentity> usedVariables() {
        return variables;
    }

    @Override
    public boolean indexOriginIsOneBased() {
        return oneBased;
    }
}
