package ai.diagram.composer.config;

import java.util.Locale;

/**
 * Supported log output formats.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Log format must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "text" -> TEXT;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported log format: " + raw);
        };
    }
}
