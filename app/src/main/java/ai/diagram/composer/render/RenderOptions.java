package ai.diagram.composer.render;

import java.util.Objects;

/**
 * Layout of the emitted text: spaces per nesting level and the line terminator.
 */
public record RenderOptions(int indentWidth, String lineSeparator) {

    public static final RenderOptions DEFAULT = new RenderOptions(2, "\n");

    public RenderOptions {
        if (indentWidth < 0 || indentWidth > 8) {
            throw new IllegalArgumentException("indentWidth must be between 0 and 8");
        }
        Objects.requireNonNull(lineSeparator, "lineSeparator");
        if (!lineSeparator.equals("\n") && !lineSeparator.equals("\r\n")) {
            throw new IllegalArgumentException("lineSeparator must be \\n or \\r\\n");
        }
    }

    public String indent() {
        return " ".repeat(indentWidth);
    }
}
