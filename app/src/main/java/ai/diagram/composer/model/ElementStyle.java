package ai.diagram.composer.model;

import java.util.Optional;

/**
 * Properties for one selector of the diagram-wide {@code <style>} block.
 */
public record ElementStyle(
        Optional<Fill> background,
        Optional<Color> lineColor,
        Optional<Color> fontColor,
        Optional<String> fontName,
        Optional<Integer> fontSize,
        Optional<FontStyle> fontStyle,
        Optional<Integer> roundCorner,
        Optional<Integer> lineThickness
) {

    public ElementStyle {
        background = background == null ? Optional.empty() : background;
        lineColor = lineColor == null ? Optional.empty() : lineColor;
        fontColor = fontColor == null ? Optional.empty() : fontColor;
        fontName = fontName == null ? Optional.empty() : fontName.filter(value -> !value.isBlank());
        fontSize = fontSize == null ? Optional.empty() : fontSize;
        fontStyle = fontStyle == null ? Optional.empty() : fontStyle;
        roundCorner = roundCorner == null ? Optional.empty() : roundCorner;
        lineThickness = lineThickness == null ? Optional.empty() : lineThickness;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return background.isEmpty() && lineColor.isEmpty() && fontColor.isEmpty() && fontName.isEmpty()
                && fontSize.isEmpty() && fontStyle.isEmpty() && roundCorner.isEmpty() && lineThickness.isEmpty();
    }

    public static final class Builder {

        private Fill background;
        private Color lineColor;
        private Color fontColor;
        private String fontName;
        private Integer fontSize;
        private FontStyle fontStyle;
        private Integer roundCorner;
        private Integer lineThickness;

        private Builder() {
        }

        public Builder background(Fill value) {
            this.background = value;
            return this;
        }

        public Builder lineColor(Color value) {
            this.lineColor = value;
            return this;
        }

        public Builder fontColor(Color value) {
            this.fontColor = value;
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

        public Builder fontStyle(FontStyle value) {
            this.fontStyle = value;
            return this;
        }

        public Builder roundCorner(int value) {
            this.roundCorner = value;
            return this;
        }

        public Builder lineThickness(int value) {
            this.lineThickness = value;
            return this;
        }

        public ElementStyle build() {
            return new ElementStyle(Optional.ofNullable(background), Optional.ofNullable(lineColor),
                    Optional.ofNullable(fontColor), Optional.ofNullable(fontName), Optional.ofNullable(fontSize),
                    Optional.ofNullable(fontStyle), Optional.ofNullable(roundCorner), Optional.ofNullable(lineThickness));
        }
    }
}
