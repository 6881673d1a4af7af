package ai.diagram.composer.model;

import java.util.Locale;

/**
 * Named or hexadecimal color value.
 */
public record Color(String value) implements Fill {

    public Color {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("color must not be blank");
        }
    }

    public static Color named(String name) {
        return new Color(name);
    }

    public static Color hex(String code) {
        return new Color(code.startsWith("#") ? code : "#" + code);
    }

    public static Color rgb(int red, int green, int blue) {
        return new Color(String.format(Locale.ROOT, "#%02X%02X%02X", channel(red), channel(green), channel(blue)));
    }

    /**
     * Alpha comes first in the rendered value.
     */
    public static Color rgba(int red, int green, int blue, int alpha) {
        return new Color(String.format(Locale.ROOT, "#%02X%02X%02X%02X",
                channel(alpha), channel(red), channel(green), channel(blue)));
    }

    private static int channel(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("color channel must be between 0 and 255: " + value);
        }
        return value;
    }
}
