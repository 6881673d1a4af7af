package ai.diagram.composer.render;

import static org.assertj.core.api.Assertions.assertThat;

import ai.diagram.composer.builder.StateDiagramBuilder;
import ai.diagram.composer.model.Color;
import ai.diagram.composer.model.Footer;
import ai.diagram.composer.model.Header;
import ai.diagram.composer.model.HorizontalAlignment;
import ai.diagram.composer.model.LayoutDirection;
import ai.diagram.composer.model.Legend;
import ai.diagram.composer.model.LegendPosition;
import ai.diagram.composer.model.Scale;
import ai.diagram.composer.model.StateDiagramStyle;
import org.junit.jupiter.api.Test;

class MetadataRendererTest {

    private final StateDiagramRenderer renderer = new StateDiagramRenderer();

    @Test
    void directivesPrecedeElementsInFixedOrder() {
        StateDiagramBuilder d = StateDiagramBuilder.create()
                .hideEmptyDescription(true)
                .layout(LayoutDirection.LEFT_TO_RIGHT)
                .legend(new Legend("A\nB", null))
                .caption("Figure 1")
                .footer(new Footer("page", HorizontalAlignment.CENTER))
                .header(new Header("draft", HorizontalAlignment.RIGHT))
                .title("Orders")
                .scale(Scale.factor(1.5))
                .style(StateDiagramStyle.builder().fontColor(Color.named("black")).build())
                .theme("cerulean");
        d.state("Idle");

        assertThat(renderer.render(d.build())).isEqualTo(String.join("\n",
                "@startuml",
                "!theme cerulean",
                "<style>",
                "stateDiagram {",
                "  FontColor black",
                "}",
                "</style>",
                "scale 1.5",
                "title Orders",
                "right header draft",
                "center footer page",
                "caption Figure 1",
                "legend",
                "  A",
                "  B",
                "endlegend",
                "left to right direction",
                "hide empty description",
                "state Idle",
                "@enduml"));
    }

    @Test
    void multiLineTextUsesBlockForm() {
        StateDiagramBuilder d = StateDiagramBuilder.create()
                .title("Line one\nLine \"two\"")
                .header(new Header("a\nb", HorizontalAlignment.LEFT))
                .legend(new Legend("key", LegendPosition.TOP));

        assertThat(renderer.render(d.build())).isEqualTo(String.join("\n",
                "@startuml",
                "title",
                "  Line one",
                "  Line <U+0022>two<U+0022>",
                "end title",
                "header",
                "  a",
                "  b",
                "endheader",
                "legend top",
                "  key",
                "endlegend",
                "@enduml"));
    }

    @Test
    void scalePrefersMaximumThenExactThenFactor() {
        assertThat(MetadataRenderer.scale(Scale.max(1024, 768))).isEqualTo("scale max 1024*768");
        assertThat(MetadataRenderer.scale(Scale.max(1024, null))).isEqualTo("scale max 1024 width");
        assertThat(MetadataRenderer.scale(Scale.max(null, 768))).isEqualTo("scale max 768 height");
        assertThat(MetadataRenderer.scale(Scale.size(200, 100))).isEqualTo("scale 200*100");
        assertThat(MetadataRenderer.scale(Scale.size(200, null))).isEqualTo("scale 200 width");
        assertThat(MetadataRenderer.scale(Scale.size(null, 100))).isEqualTo("scale 100 height");
        assertThat(MetadataRenderer.scale(Scale.factor(2.0))).isEqualTo("scale 2");
    }
}
