package ai.diagram.composer.model;

public enum HorizontalAlignment {
    LEFT,
    CENTER,
    RIGHT
}
