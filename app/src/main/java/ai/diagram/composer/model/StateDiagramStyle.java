package ai.diagram.composer.model;

import java.util.Optional;

/**
 * Typed content of the {@code <style>} block: root properties plus per-selector styles.
 */
public record StateDiagramStyle(
        Optional<Fill> background,
        Optional<String> fontName,
        Optional<Integer> fontSize,
        Optional<Color> fontColor,
        Optional<ElementStyle> state,
        Optional<DiagramArrowStyle> arrow,
        Optional<ElementStyle> note,
        Optional<ElementStyle> title
) {

    public StateDiagramStyle {
        background = background == null ? Optional.empty() : background;
        fontName = fontName == null ? Optional.empty() : fontName.filter(value -> !value.isBlank());
        fontSize = fontSize == null ? Optional.empty() : fontSize;
        fontColor = fontColor == null ? Optional.empty() : fontColor;
        state = state == null ? Optional.empty() : state;
        arrow = arrow == null ? Optional.empty() : arrow;
        note = note == null ? Optional.empty() : note;
        title = title == null ? Optional.empty() : title;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Fill background;
        private String fontName;
        private Integer fontSize;
        private Color fontColor;
        private ElementStyle state;
        private DiagramArrowStyle arrow;
        private ElementStyle note;
        private ElementStyle title;

        private Builder() {
        }

        public Builder background(Fill value) {
            this.background = value;
            return this;
        }

        public Builder fontName(String value) {
            this.fontName = value;
            return this;
        }

        public Builder fontSize(int value) {
            this.fontSize = value;
            return this;
        }

        public Builder fontColor(Color value) {
            this.fontColor = value;
            return this;
        }

        public Builder state(ElementStyle value) {
            this.state = value;
            return this;
        }

        public Builder arrow(DiagramArrowStyle value) {
            this.arrow = value;
            return this;
        }

        public Builder note(ElementStyle value) {
            this.note = value;
            return this;
        }

        public Builder title(ElementStyle value) {
            this.title = value;
            return this;
        }

        public StateDiagramStyle build() {
            return new StateDiagramStyle(Optional.ofNullable(background), Optional.ofNullable(fontName),
                    Optional.ofNullable(fontSize), Optional.ofNullable(fontColor), Optional.ofNullable(state),
                    Optional.ofNullable(arrow), Optional.ofNullable(note), Optional.ofNullable(title));
        }
    }
}
