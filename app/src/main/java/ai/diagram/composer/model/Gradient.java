package ai.diagram.composer.model;

import java.util.Objects;

/**
 * Two-color background gradient.
 */
public record Gradient(Color start, Color end, GradientDirection direction) implements Fill {

    public Gradient {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        direction = direction == null ? GradientDirection.HORIZONTAL : direction;
    }

    public static Gradient of(Color start, Color end) {
        return new Gradient(start, end, GradientDirection.HORIZONTAL);
    }
}
