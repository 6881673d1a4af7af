package ai.diagram.composer.model;

import java.util.Locale;

public enum FontStyle {
    NORMAL,
    BOLD,
    ITALIC,
    UNDERLINE,
    STRIKE;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
