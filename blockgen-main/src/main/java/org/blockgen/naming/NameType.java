package org.blockgen.naming;

public enum NameType {
    VARIABLE,
    DEVELOPER_VARIABLE,
    PROCEDURE
}
