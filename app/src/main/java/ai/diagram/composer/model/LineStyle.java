package ai.diagram.composer.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Visual styling for transition arrows and state borders.
 */
public record LineStyle(LinePattern pattern, Optional<Color> color, Optional<Integer> thickness, boolean bold) {

    public static final LineStyle DEFAULT = new LineStyle(LinePattern.SOLID, Optional.empty(), Optional.empty(), false);

    public LineStyle {
        Objects.requireNonNull(pattern, "pattern");
        color = color == null ? Optional.empty() : color;
        thickness = thickness == null ? Optional.empty() : thickness;
        thickness.ifPresent(value -> {
            if (value <= 0) {
                throw new IllegalArgumentException("thickness must be greater than zero");
            }
        });
    }

    public static LineStyle of(LinePattern pattern) {
        return DEFAULT.withPattern(pattern);
    }

    public static LineStyle of(Color color) {
        return DEFAULT.withColor(color);
    }

    public LineStyle withPattern(LinePattern value) {
        return new LineStyle(value, color, thickness, bold);
    }

    public LineStyle withColor(Color value) {
        return new LineStyle(pattern, Optional.of(value), thickness, bold);
    }

    public LineStyle withThickness(int value) {
        return new LineStyle(pattern, color, Optional.of(value), bold);
    }

    public LineStyle withBold(boolean value) {
        return new LineStyle(pattern, color, thickness, value);
    }
}
