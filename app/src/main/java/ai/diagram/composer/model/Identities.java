package ai.diagram.composer.model;

import ai.diagram.composer.error.EmptyNameException;
import java.util.Set;

/**
 * Derives referencing identities from display names.
 */
public final class Identities {

    public static final String INITIAL = "initial";
    public static final String FINAL = "final";
    public static final String HISTORY = "history";
    public static final String DEEP_HISTORY = "deep_history";

    private static final String STRIPPED_CHARACTERS = "\"'`()[]{}:;,.<>!@#$%^&*+=|\\/?~";
    private static final Set<String> GLOBAL_PSEUDO_IDENTITIES = Set.of(
            INITIAL, FINAL, HISTORY, DEEP_HISTORY, "[*]", "[H]", "[H*]");

    private Identities() {
    }

    /**
     * Returns the alias when present, the sanitized name otherwise.
     */
    public static String derive(String name, String alias) {
        if (alias != null && !alias.isBlank()) {
            return requireAlias(alias);
        }
        return sanitize(name);
    }

    /**
     * Spaces become underscores and markup-breaking characters are dropped; an empty result becomes {@code _}.
     */
    public static String sanitize(String name) {
        if (name == null) {
            return "_";
        }
        StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (ch == ' ') {
                builder.append('_');
            } else if (STRIPPED_CHARACTERS.indexOf(ch) < 0) {
                builder.append(ch);
            }
        }
        return builder.length() == 0 ? "_" : builder.toString();
    }

    /**
     * Aliases are written bare after {@code as}, so whitespace and the characters {@link #sanitize} drops are refused.
     */
    public static String requireAlias(String alias) {
        for (int i = 0; i < alias.length(); i++) {
            char ch = alias.charAt(i);
            if (Character.isWhitespace(ch) || STRIPPED_CHARACTERS.indexOf(ch) >= 0) {
                throw new IllegalArgumentException("Alias '" + alias + "' contains '" + ch
                        + "', which cannot appear in a bare identity; use letters, digits, '_' or '-'");
            }
        }
        return alias;
    }

    public static boolean isGlobalPseudoIdentity(String identity) {
        return GLOBAL_PSEUDO_IDENTITIES.contains(identity);
    }

    public static Set<String> globalPseudoIdentities() {
        return GLOBAL_PSEUDO_IDENTITIES;
    }

    public static String requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new EmptyNameException(what + " name must not be blank");
        }
        return value;
    }
}
