package ai.diagram.composer.model;

import java.util.Objects;

/**
 * Colored circle with a single character shown in front of a stereotype.
 */
public record Spot(char character, Color color) {

    public Spot {
        Objects.requireNonNull(color, "color");
    }
}
