package ai.diagram.composer.model;

/**
 * Separator drawn between the regions of a concurrent state.
 */
public enum RegionSeparator {
    HORIZONTAL("--"),
    VERTICAL("||");

    private final String token;

    RegionSeparator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static RegionSeparator from(String raw) {
        if (raw == null || raw.isBlank()) {
            return HORIZONTAL;
        }
        for (RegionSeparator separator : values()) {
            if (separator.name().equalsIgnoreCase(raw.trim()) || separator.token.equals(raw.trim())) {
                return separator;
            }
        }
        throw new IllegalArgumentException("Unsupported region separator: " + raw);
    }
}
