package org.blockgen.block;

import java.util.Objects;

/**
 * A variable as the workspace knows it: a stable {@code id} and the name the author typed. Two
 * identities are the same variable when their ids match, whatever their names.
 */
public record VarIdentity(String id, String name) {

    public VarIdentity {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Developer variables have no separate display name; the id is the desired name.
     */
    public static VarIdentity developer(String name) {
        return new VarIdentity(name, name);
    }
}
