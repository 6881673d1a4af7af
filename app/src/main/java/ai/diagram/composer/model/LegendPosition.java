package ai.diagram.composer.model;

public enum LegendPosition {
    LEFT,
    RIGHT,
    TOP,
    BOTTOM,
    CENTER
}
