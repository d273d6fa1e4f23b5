package org.blockgen.block;

public enum InputKind {
    VALUE,
    STATEMENT,
    DUMMY
}
