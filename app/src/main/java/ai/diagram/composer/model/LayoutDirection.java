package ai.diagram.composer.model;

public enum LayoutDirection {
    TOP_TO_BOTTOM("top to bottom direction"),
    LEFT_TO_RIGHT("left to right direction");

    private final String directive;

    LayoutDirection(String directive) {
        this.directive = directive;
    }

    public String directive() {
        return directive;
    }
}
