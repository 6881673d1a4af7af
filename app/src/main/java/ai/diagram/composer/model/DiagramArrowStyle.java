package ai.diagram.composer.model;

import java.util.Optional;

/**
 * Diagram-wide arrow defaults for the {@code <style>} block.
 */
public record DiagramArrowStyle(Optional<Color> lineColor, Optional<Integer> lineThickness, Optional<LinePattern> linePattern) {

    public DiagramArrowStyle {
        lineColor = lineColor == null ? Optional.empty() : lineColor;
        lineThickness = lineThickness == null ? Optional.empty() : lineThickness;
        linePattern = linePattern == null ? Optional.empty() : linePattern;
    }

    public boolean isEmpty() {
        return lineColor.isEmpty() && lineThickness.isEmpty() && linePattern.isEmpty();
    }
}
