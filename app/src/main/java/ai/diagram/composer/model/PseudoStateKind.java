package ai.diagram.composer.model;

/**
 * Control markers. The four implicit kinds need no name and resolve to fixed global identities.
 */
public enum PseudoStateKind {
    INITIAL(Identities.INITIAL, true),
    FINAL(Identities.FINAL, true),
    CHOICE("choice", false),
    FORK("fork", false),
    JOIN("join", false),
    HISTORY(Identities.HISTORY, true),
    DEEP_HISTORY(Identities.DEEP_HISTORY, true),
    ENTRY_POINT("entryPoint", false),
    EXIT_POINT("exitPoint", false),
    INPUT_PIN("inputPin", false),
    OUTPUT_PIN("outputPin", false),
    SDL_RECEIVE("sdlreceive", false),
    EXPANSION_INPUT("expansionInput", false),
    EXPANSION_OUTPUT("expansionOutput", false);

    private final String token;
    private final boolean implicit;

    PseudoStateKind(String token, boolean implicit) {
        this.token = token;
        this.implicit = implicit;
    }

    /**
     * Stereotype for declared kinds, global identity for implicit ones.
     */
    public String token() {
        return token;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public static PseudoStateKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("pseudo-state kind must not be blank");
        }
        for (PseudoStateKind kind : values()) {
            if (kind.token.equalsIgnoreCase(raw) || kind.name().equalsIgnoreCase(raw)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported pseudo-state kind: " + raw);
    }
}
