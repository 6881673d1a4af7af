package ai.diagram.composer.model;

/**
 * Layout hint for a single transition.
 */
public enum Direction {
    UP,
    DOWN,
    LEFT,
    RIGHT;

    public char letter() {
        return Character.toLowerCase(name().charAt(0));
    }
}
