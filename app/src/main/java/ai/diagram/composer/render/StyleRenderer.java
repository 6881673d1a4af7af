package ai.diagram.composer.render;

import ai.diagram.composer.model.Color;
import ai.diagram.composer.model.DiagramArrowStyle;
import ai.diagram.composer.model.ElementStyle;
import ai.diagram.composer.model.Fill;
import ai.diagram.composer.model.Gradient;
import ai.diagram.composer.model.LinePattern;
import ai.diagram.composer.model.LineStyle;
import ai.diagram.composer.model.StateDiagramStyle;
import ai.diagram.composer.model.Stereotype;
import ai.diagram.composer.model.Style;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders colors, inline element styles, arrow style brackets, stereotypes and the {@code <style>} block.
 */
public class StyleRenderer {

    public String color(Fill fill) {
        if (fill instanceof Color color) {
            return color.value();
        }
        if (fill instanceof Gradient gradient) {
            return color(gradient.start()) + gradient.direction().separator() + color(gradient.end());
        }
        throw new IllegalStateException("Unknown fill type: " + (fill == null ? "null" : fill.getClass().getName()));
    }

    /**
     * {@code [#red,dashed,bold,thickness=2]}, or an empty string when the style changes nothing.
     */
    public String lineBracket(LineStyle style) {
        List<String> parts = new ArrayList<>();
        style.color().ifPresent(value -> parts.add(withHash(color(value))));
        if (style.pattern() != LinePattern.SOLID) {
            parts.add(style.pattern().token());
        }
        if (style.bold()) {
            parts.add("bold");
        }
        style.thickness().ifPresent(value -> parts.add("thickness=" + value));
        return parts.isEmpty() ? "" : "[" + String.join(",", parts) + "]";
    }

    /**
     * Inline style for a declaration. Background and border use the space separated form
     * ({@code #pink ##[dashed]red}); once a text color is involved the semicolon form is required
     * ({@code #pink;line.dashed;line:red;text:blue}).
     */
    public String inline(Style style) {
        Optional<LineStyle> line = style.line()
                .filter(value -> value.color().isPresent() || value.pattern() != LinePattern.SOLID);

        if (style.textColor().isEmpty()) {
            List<String> parts = new ArrayList<>();
            style.background().ifPresent(value -> parts.add(withHash(color(value))));
            line.ifPresent(value -> {
                String pattern = value.pattern() == LinePattern.SOLID ? "" : "[" + value.pattern().token() + "]";
                String lineColor = value.color().map(this::color).orElse("");
                if (lineColor.startsWith("#")) {
                    lineColor = lineColor.substring(1);
                }
                parts.add("##" + pattern + lineColor);
            });
            return String.join(" ", parts);
        }

        List<String> properties = new ArrayList<>();
        style.background().ifPresent(value -> properties.add(withHash(color(value))));
        line.ifPresent(value -> {
            if (value.pattern() != LinePattern.SOLID) {
                properties.add("line." + value.pattern().token());
            }
            value.color().ifPresent(lineColor -> properties.add("line:" + color(lineColor)));
        });
        style.textColor().ifPresent(value -> properties.add("text:" + color(value)));
        return withHash(String.join(";", properties));
    }

    public String stereotype(Stereotype stereotype) {
        if (stereotype.spot().isPresent()) {
            var spot = stereotype.spot().get();
            return "<< (" + spot.character() + "," + withHash(color(spot.color())) + ") " + stereotype.name() + " >>";
        }
        return "<<" + stereotype.name() + ">>";
    }

    /**
     * Lines of the {@code <style>} block, empty when the style sets nothing.
     */
    public List<String> styleBlock(StateDiagramStyle style, String indent) {
        List<String> diagramProperties = new ArrayList<>();
        style.background().ifPresent(value -> diagramProperties.add(indent + "BackgroundColor " + color(value)));
        style.fontName().ifPresent(value -> diagramProperties.add(indent + "FontName " + value));
        style.fontSize().ifPresent(value -> diagramProperties.add(indent + "FontSize " + value));
        style.fontColor().ifPresent(value -> diagramProperties.add(indent + "FontColor " + color(value)));
        style.state().ifPresent(value -> diagramProperties.addAll(selector("state", value, indent)));
        style.arrow().ifPresent(value -> diagramProperties.addAll(arrowSelector(value, indent)));
        style.note().ifPresent(value -> diagramProperties.addAll(selector("note", value, indent)));

        List<String> documentProperties = new ArrayList<>();
        style.title().ifPresent(value -> documentProperties.addAll(selector("title", value, indent)));

        if (diagramProperties.isEmpty() && documentProperties.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        lines.add("<style>");
        if (!diagramProperties.isEmpty()) {
            lines.add("stateDiagram {");
            lines.addAll(diagramProperties);
            lines.add("}");
        }
        if (!documentProperties.isEmpty()) {
            lines.add("document {");
            lines.addAll(documentProperties);
            lines.add("}");
        }
        lines.add("</style>");
        return lines;
    }

    private List<String> selector(String name, ElementStyle style, String indent) {
        if (style.isEmpty()) {
            return List.of();
        }
        String inner = indent + indent;
        List<String> lines = new ArrayList<>();
        lines.add(indent + name + " {");
        style.background().ifPresent(value -> lines.add(inner + "BackgroundColor " + color(value)));
        style.lineColor().ifPresent(value -> lines.add(inner + "LineColor " + color(value)));
        style.fontColor().ifPresent(value -> lines.add(inner + "FontColor " + color(value)));
        style.fontName().ifPresent(value -> lines.add(inner + "FontName " + value));
        style.fontSize().ifPresent(value -> lines.add(inner + "FontSize " + value));
        style.fontStyle().ifPresent(value -> lines.add(inner + "FontStyle " + value.token()));
        style.roundCorner().ifPresent(value -> lines.add(inner + "RoundCorner " + value));
        style.lineThickness().ifPresent(value -> lines.add(inner + "LineThickness " + value));
        lines.add(indent + "}");
        return lines;
    }

    private List<String> arrowSelector(DiagramArrowStyle style, String indent) {
        if (style.isEmpty()) {
            return List.of();
        }
        String inner = indent + indent;
        List<String> lines = new ArrayList<>();
        lines.add(indent + "arrow {");
        style.lineColor().ifPresent(value -> lines.add(inner + "LineColor " + color(value)));
        style.lineThickness().ifPresent(value -> lines.add(inner + "LineThickness " + value));
        style.linePattern().ifPresent(value -> lines.add(inner + "LineStyle " + value.token()));
        lines.add(indent + "}");
        return lines;
    }

    private static String withHash(String value) {
        return value.startsWith("#") ? value : "#" + value;
    }
}
