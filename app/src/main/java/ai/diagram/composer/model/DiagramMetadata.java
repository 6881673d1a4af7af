package ai.diagram.composer.model;

import java.util.Optional;

/**
 * Diagram-wide settings rendered ahead of the element sequence.
 */
public record DiagramMetadata(
        Optional<String> title,
        Optional<String> caption,
        Optional<Header> header,
        Optional<Footer> footer,
        Optional<Legend> legend,
        Optional<Scale> scale,
        Optional<String> theme,
        Optional<LayoutDirection> layout,
        boolean hideEmptyDescription,
        Optional<StateDiagramStyle> style
) {

    public static final DiagramMetadata EMPTY = new DiagramMetadata(Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), false,
            Optional.empty());

    public DiagramMetadata {
        title = nonBlank(title);
        caption = nonBlank(caption);
        header = header == null ? Optional.empty() : header;
        footer = footer == null ? Optional.empty() : footer;
        legend = legend == null ? Optional.empty() : legend;
        scale = scale == null ? Optional.empty() : scale;
        theme = nonBlank(theme);
        layout = layout == null ? Optional.empty() : layout;
        style = style == null ? Optional.empty() : style;
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value == null ? Optional.empty() : value.filter(text -> !text.isBlank());
    }
}
