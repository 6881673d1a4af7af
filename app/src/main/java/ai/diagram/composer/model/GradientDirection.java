package ai.diagram.composer.model;

public enum GradientDirection {
    HORIZONTAL('|'),
    VERTICAL('-'),
    DIAGONAL_DOWN('/'),
    DIAGONAL_UP('\\');

    private final char separator;

    GradientDirection(char separator) {
        this.separator = separator;
    }

    public char separator() {
        return separator;
    }
}
