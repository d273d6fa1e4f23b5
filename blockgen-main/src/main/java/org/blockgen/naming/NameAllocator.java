package org.blockgen.naming;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.blockgen.block.VarIdentity;
import org.blockgen.block.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps variable identities to collision-free names for one generation pass and collects the
 * declarations that go on top of the program.
 * <p>
 * Names are only handed out between {@link #init(Workspace)} and {@link #finish(String)}.
 */
public final class NameAllocator {

    private static final Logger log = LoggerFactory.getLogger(NameAllocator.class);

    private static final String UNNAMED = "unnamed";

    // ASCII punctuation that URI encoding leaves alone; it becomes a plain underscore.
    private static final String URI_UNESCAPED = ";,/?:@&=+$-_.!~*'()#";

    private final Set<String> reservedWords;

    private final Map<NameType, Map<String, String>> names = new EnumMap<>(NameType.class);
    private final Set<String> allocated = new HashSet<>();
    private final Map<String, VarIdentity> knownVariables = new HashMap<>();
    private final DeclarationTable declarations = new DeclarationTable();

    private boolean active;

    public NameAllocator(Set<String> reservedWords) {
        this.reservedWords = Set.copyOf(reservedWords);
    }

    /**
     * Resets all allocations and declares the developer variables followed by the author variables
     * that are actually used.
     */
    public void init(Workspace workspace) {
        reset();
        active = true;

        List<String> defvars = new ArrayList<>();
        for (VarIdentity developerVar : workspace.developerVariables()) {
            knownVariables.put(developerVar.id(), developerVar);
            defvars.add(getName(developerVar, NameType.DEVELOPER_VARIABLE));
        }
        for (VarIdentity variable : workspace.usedVariables()) {
            knownVariables.put(variable.id(), variable);
            defvars.add(getName(variable, NameType.VARIABLE));
        }

        if (!defvars.isEmpty()) {
            declarations.put(DeclarationTable.VARIABLES, "var " + String.join(", ", defvars) + ";");
        }
        log.debug("Declared {} variable(s): {}", defvars.size(), defvars);
    }

    /**
     * Prepends the collected declarations to {@code code} and ends the pass.
     */
    public String finish(String code) {
        checkActive();
        String definitions = declarations.render();
        reset();
        return definitions + "\n\n\n" + code;
    }

    /**
     * The name of a variable, stable for the whole pass.
     */
    public String getName(VarIdentity identity, NameType type) {
        checkActive();
        Map<String, String> typeNames = names.computeIfAbsent(type, t -> new HashMap<>());
        String existing = typeNames.get(identity.id());
        if (existing != null) {
            return existing;
        }
        String name = getDistinctName(identity.name(), type);
        typeNames.put(identity.id(), name);
        return name;
    }

    /**
     * Looks the variable up by id among those declared at {@link #init(Workspace)}; an unknown id is
     * taken as the desired name.
     */
    public String getName(String id, NameType type) {
        checkActive();
        VarIdentity identity = knownVariables.get(id);
        return getName(identity != null ? identity : VarIdentity.developer(id), type);
    }

    /**
     * A name that is neither reserved nor already taken in this pass, derived from {@code desiredName}.
     * Every call allocates a new name.
     */
    public String getDistinctName(String desiredName, NameType type) {
        checkActive();
        String safeName = safeName(desiredName);
        String candidate = safeName;
        int suffix = 1;
        while (allocated.contains(candidate) || reservedWords.contains(candidate)) {
            suffix++;
            candidate = safeName + suffix;
        }
        allocated.add(candidate);
        return candidate;
    }

    public boolean isReserved(String name) {
        return reservedWords.contains(name);
    }

    public boolean isActive() {
        return active;
    }

    public DeclarationTable declarations() {
        checkActive();
        return declarations;
    }

    /**
     * Turns arbitrary text into a legal identifier, the way a URI-encode-then-underscore pass would.
     * Spaces and URI-safe punctuation become underscores; every other character is spelled out as its
     * UTF-8 bytes ({@code "} becomes {@code _22}, {@code ü} becomes {@code _C3_BC}). A leading digit
     * gets a {@code my_} prefix.
     */
    static String safeName(String name) {
        if (name == null || name.isEmpty()) {
            return UNNAMED;
        }
        StringBuilder out = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); ) {
            int codePoint = name.codePointAt(i);
            i += Character.charCount(codePoint);
            if (isWordChar(codePoint)) {
                out.append((char) codePoint);
            } else if (codePoint == ' ' || URI_UNESCAPED.indexOf(codePoint) >= 0) {
                out.append('_');
            } else {
                for (byte b : new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8)) {
                    out.append('_').append(String.format("%02X", b & 0xFF));
                }
            }
        }
        if (Character.isDigit(out.charAt(0))) {
            out.insert(0, "my_");
        }
        return out.toString();
    }

    private static boolean isWordChar(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private void reset() {
        names.clear();
        allocated.clear();
        knownVariables.clear();
        declarations.clear();
        active = false;
    }

    private void checkActive() {
        if (!active) {
            throw new IllegalStateException("Name allocation requires an initialized generation pass");
        }
    }
}
