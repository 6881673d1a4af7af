package ai.diagram.composer.model;

/**
 * Placement hint for notes.
 */
public enum NotePosition {
    LEFT("left", true),
    RIGHT("right", true),
    TOP("top", true),
    BOTTOM("bottom", true),
    ON_LINK("on link", false),
    FLOATING("floating", false);

    private final String keyword;
    private final boolean anchorable;

    NotePosition(String keyword, boolean anchorable) {
        this.keyword = keyword;
        this.anchorable = anchorable;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isAnchorable() {
        return anchorable;
    }
}
