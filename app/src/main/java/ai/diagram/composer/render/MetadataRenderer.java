package ai.diagram.composer.render;

import ai.diagram.composer.model.DiagramMetadata;
import ai.diagram.composer.model.Footer;
import ai.diagram.composer.model.Header;
import ai.diagram.composer.model.HorizontalAlignment;
import ai.diagram.composer.model.Legend;
import ai.diagram.composer.model.LegendPosition;
import ai.diagram.composer.model.Scale;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Emits the directives that precede the element sequence.
 */
class MetadataRenderer {

    private final StyleRenderer styles;
    private final String indent;

    MetadataRenderer(StyleRenderer styles, RenderOptions options) {
        this.styles = Objects.requireNonNull(styles, "styles");
        this.indent = Objects.requireNonNull(options, "options").indent();
    }

    List<String> render(DiagramMetadata metadata) {
        List<String> lines = new ArrayList<>();
        metadata.theme().ifPresent(theme -> lines.add("!theme " + theme));
        metadata.style().ifPresent(style -> lines.addAll(styles.styleBlock(style, indent)));
        metadata.scale().map(MetadataRenderer::scale).filter(line -> !line.isEmpty()).ifPresent(lines::add);
        metadata.title().ifPresent(title -> lines.addAll(title(title)));
        metadata.header().ifPresent(header -> lines.addAll(header(header)));
        metadata.footer().ifPresent(footer -> lines.addAll(footer(footer)));
        metadata.caption().ifPresent(caption -> lines.add("caption " + PlantUmlText.escapeQuotes(caption)));
        metadata.legend().ifPresent(legend -> lines.addAll(legend(legend)));
        metadata.layout().ifPresent(layout -> lines.add(layout.directive()));
        if (metadata.hideEmptyDescription()) {
            lines.add("hide empty description");
        }
        return lines;
    }

    private List<String> title(String title) {
        if (!PlantUmlText.isMultiline(title)) {
            return List.of("title " + PlantUmlText.escapeQuotes(title));
        }
        return block("title", title, "end title");
    }

    private List<String> header(Header header) {
        String prefix = aligned(header.alignment(), "header");
        return single(prefix, header.content(), "endheader");
    }

    private List<String> footer(Footer footer) {
        String prefix = aligned(footer.alignment(), "footer");
        return single(prefix, footer.content(), "endfooter");
    }

    private List<String> legend(Legend legend) {
        String opening = legend.position() == LegendPosition.RIGHT
                ? "legend"
                : "legend " + legend.position().name().toLowerCase(Locale.ROOT);
        return block(opening, legend.content(), "endlegend");
    }

    static String scale(Scale scale) {
        if (scale.maxWidth().isPresent() && scale.maxHeight().isPresent()) {
            return "scale max " + scale.maxWidth().get() + "*" + scale.maxHeight().get();
        }
        if (scale.maxWidth().isPresent()) {
            return "scale max " + scale.maxWidth().get() + " width";
        }
        if (scale.maxHeight().isPresent()) {
            return "scale max " + scale.maxHeight().get() + " height";
        }
        if (scale.width().isPresent() && scale.height().isPresent()) {
            return "scale " + scale.width().get() + "*" + scale.height().get();
        }
        if (scale.width().isPresent()) {
            return "scale " + scale.width().get() + " width";
        }
        if (scale.height().isPresent()) {
            return "scale " + scale.height().get() + " height";
        }
        return scale.factor()
                .map(factor -> "scale " + BigDecimal.valueOf(factor).stripTrailingZeros().toPlainString())
                .orElse("");
    }

    private static String aligned(HorizontalAlignment alignment, String keyword) {
        return switch (alignment) {
            case CENTER -> "center " + keyword;
            case RIGHT -> "right " + keyword;
            case LEFT -> keyword;
        };
    }

    private List<String> single(String prefix, String content, String closing) {
        if (PlantUmlText.isMultiline(content)) {
            return block(prefix, content, closing);
        }
        return List.of(prefix + " " + PlantUmlText.escapeQuotes(content));
    }

    private List<String> block(String opening, String content, String closing) {
        List<String> lines = new ArrayList<>();
        lines.add(opening);
        for (String line : PlantUmlText.escapeQuotes(content).split("\n", -1)) {
            lines.add(indent + line);
        }
        lines.add(closing);
        return lines;
    }
}
