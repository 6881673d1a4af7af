package ai.diagram.composer.model;

import java.util.Optional;

/**
 * Inline styling for a state or pseudo-state declaration.
 */
public record Style(
        Optional<Fill> background,
        Optional<LineStyle> line,
        Optional<Color> textColor,
        Optional<Stereotype> stereotype
) {

    public static final Style NONE = new Style(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public Style {
        background = background == null ? Optional.empty() : background;
        line = line == null ? Optional.empty() : line;
        textColor = textColor == null ? Optional.empty() : textColor;
        stereotype = stereotype == null ? Optional.empty() : stereotype;
    }

    public static Style background(Fill fill) {
        return NONE.withBackground(fill);
    }

    public static Style stereotype(Stereotype value) {
        return NONE.withStereotype(value);
    }

    public Style withBackground(Fill value) {
        return new Style(Optional.of(value), line, textColor, stereotype);
    }

    public Style withLine(LineStyle value) {
        return new Style(background, Optional.of(value), textColor, stereotype);
    }

    public Style withTextColor(Color value) {
        return new Style(background, line, Optional.of(value), stereotype);
    }

    public Style withStereotype(Stereotype value) {
        return new Style(background, line, textColor, Optional.of(value));
    }
}
