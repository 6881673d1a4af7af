package ai.diagram.composer.model;

import java.util.Locale;

public enum LinePattern {
    SOLID,
    DASHED,
    DOTTED,
    HIDDEN;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
