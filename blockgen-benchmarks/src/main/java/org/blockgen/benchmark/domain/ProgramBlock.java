package org.blockgen.benchmark.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.blockgen.block.BlockInput;
import org.blockgen.block.BlockNode;
import org.blockgen.block.Workspace;

/**
 * Plain mutable block used to assemble benchmark programs.
 */
public class ProgramBlock implements BlockNode {

    private final String type;
    private final String id;
    private final boolean hasOutput;
    private final List<BlockInput> inputs = new ArrayList<>();
    private final Map<String, String> fields = new HashMap<>();

    private boolean outputConnected;
    private String comment;
    private ProgramBlock next;
    private Workspace workspace;

    public ProgramBlock(String type, String id, boolean hasOutput) {
        this.type = type;
        this.id = id;
        this.hasOutput = hasOutput;
    }

    public ProgramBlock setField(String name, String value) {
        fields.put(name, value);
        return this;
    }

    public ProgramBlock setValue(String name, ProgramBlock child) {
        child.outputConnected = true;
        inputs.add(BlockInput.value(name, child));
        return this;
    }

    public ProgramBlock setStatement(String name, ProgramBlock child) {
        inputs.add(BlockInput.statement(name, child));
        return this;
    }

    public ProgramBlock setNext(ProgramBlock next) {
        this.next = next;
        return this;
    }

    public ProgramBlock setComment(String comment) {
        this.comment = comment;
        return this;
    }

    void setWorkspace(Workspace workspace) {
        this.workspace = workspace;
        for (BlockInput input : inputs) {
            if (input.connectedChild() != null) {
                ((ProgramBlock) input.connectedChild()).setWorkspace(workspace);
            }
        }
        if (next != null) {
            next.setWorkspace(workspace);
        }
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean hasOutput() {
        return hasOutput;
    }

    @Override
    public boolean hasConnectedOutput() {
        return hasOutput && outputConnected;
    }

    @Override
    public Optional<BlockNode> nextStatement() {
        return Optional.ofNullable(next);
    }

    @Override
    public List<BlockInput> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public Optional<String> commentText() {
        return Optional.ofNullable(comment);
    }

    @Override
    public Workspace workspace() {
        return workspace;
    }

    @Override
    public Optional<String> fieldValue(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
