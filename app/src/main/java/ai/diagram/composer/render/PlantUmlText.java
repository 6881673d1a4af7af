package ai.diagram.composer.render;

import ai.diagram.composer.model.Identities;

/**
 * Text helpers shared by the renderers.
 */
public final class PlantUmlText {

    /**
     * PlantUML shows this token as a literal double quote; a backslash escape is not understood everywhere.
     */
    public static final String QUOTE_ESCAPE = "<U+0022>";

    private PlantUmlText() {
    }

    public static String escapeQuotes(String text) {
        return text == null ? "" : text.replace("\"", QUOTE_ESCAPE);
    }

    /**
     * {@code name} when it can be used bare, {@code "name" as identity} otherwise.
     */
    public static String declaredName(String name, String identity, boolean aliased) {
        if (aliased || !identity.equals(name)) {
            return "\"" + escapeQuotes(name) + "\" as " + identity;
        }
        return name;
    }

    /**
     * Maps the implicit pseudo-state identities to their fixed tokens.
     */
    public static String endpoint(String identity) {
        return switch (identity) {
            case Identities.INITIAL, Identities.FINAL, "[*]" -> "[*]";
            case Identities.HISTORY, "[H]" -> "[H]";
            case Identities.DEEP_HISTORY, "[H*]" -> "[H*]";
            default -> identity;
        };
    }

    public static boolean isMultiline(String text) {
        return text.indexOf('\n') >= 0;
    }
}
