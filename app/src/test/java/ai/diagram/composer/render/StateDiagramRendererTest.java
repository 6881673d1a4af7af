package ai.diagram.composer.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.diagram.composer.builder.StateDiagramBuilder;
import ai.diagram.composer.builder.StateOptions;
import ai.diagram.composer.builder.StateScope;
import ai.diagram.composer.builder.TransitionOptions;
import ai.diagram.composer.model.Color;
import ai.diagram.composer.model.DiagramMetadata;
import ai.diagram.composer.model.Direction;
import ai.diagram.composer.model.LinePattern;
import ai.diagram.composer.model.LineStyle;
import ai.diagram.composer.model.NotePosition;
import ai.diagram.composer.model.PseudoState;
import ai.diagram.composer.model.RegionSeparator;
import ai.diagram.composer.model.StateDiagram;
import ai.diagram.composer.model.StateDiagramElement;
import ai.diagram.composer.model.StateNode;
import ai.diagram.composer.model.Stereotype;
import ai.diagram.composer.model.Style;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class StateDiagramRendererTest {

    private final StateDiagramRenderer renderer = new StateDiagramRenderer();
    private final StateDiagramBuilder d = StateDiagramBuilder.create();

    @Test
    void rendersStatesAndTransitionsBetweenMarkers() {
        StateNode idle = d.state("Idle");
        StateNode active = d.state("Active");
        d.arrow(d.start(), idle);
        d.arrow(idle, active, "go");

        String text = renderer.render(d.build());

        assertThat(text).isEqualTo(String.join("\n",
                "@startuml",
                "state Idle",
                "state Active",
                "[*] --> Idle",
                "Idle --> Active : go",
                "@enduml"));
    }

    @Test
    void emptyDiagramStillHasBothMarkers() {
        assertThat(renderer.render(d.build())).isEqualTo("@startuml\n@enduml");
    }

    @Test
    void quotesInNamesSurviveAsUnicodeToken() {
        String name = "Say \"hi\"";
        d.state(name);

        String declaration = lines(renderer.render(d.build())).get(1);

        assertThat(declaration).isEqualTo("state \"Say <U+0022>hi<U+0022>\" as Say_hi");
        String quoted = declaration.substring(declaration.indexOf('"') + 1, declaration.lastIndexOf('"'));
        assertThat(quoted.replace(PlantUmlText.QUOTE_ESCAPE, "\"")).isEqualTo(name);
    }

    @Test
    void renderingIsRepeatable() {
        StateNode idle = d.state("Idle");
        d.note("first", NotePosition.FLOATING);
        d.note("second", NotePosition.FLOATING);
        d.arrow(d.start(), idle);
        StateDiagram diagram = d.build();

        String first = renderer.render(diagram);
        String second = renderer.render(diagram);

        assertThat(second).isEqualTo(first);
        assertThat(first).contains("note \"first\" as N0", "note \"second\" as N1");
    }

    @Test
    void parallelBlockRendersForkEdgesAndJoinInOrder() {
        try (StateScope checks = d.parallel("checks")) {
            try (StateScope fraud = checks.branch()) {
                fraud.state("FraudCheck");
            }
            try (StateScope balance = checks.branch()) {
                balance.arrow(balance.state("BalanceCheck"), balance.state("Hold"));
            }
        }

        List<String> lines = lines(renderer.render(d.build()));

        assertThat(lines).filteredOn(line -> line.endsWith("<<fork>>")).containsExactly("state checks_fork <<fork>>");
        assertThat(lines).filteredOn(line -> line.endsWith("<<join>>")).containsExactly("state checks_join <<join>>");
        assertThat(lines).filteredOn(line -> line.startsWith("checks_fork --> ")).hasSize(2);
        assertThat(lines).filteredOn(line -> line.endsWith(" --> checks_join")).hasSize(2);
        assertThat(lines).containsSubsequence(
                "state checks_fork <<fork>>",
                "checks_fork --> FraudCheck",
                "FraudCheck --> checks_join",
                "checks_fork --> BalanceCheck",
                "Hold --> checks_join",
                "state checks_join <<join>>");
    }

    @Test
    void nestsCompositeChildrenOneLevelDeeper() {
        try (StateScope active = d.composite("Active")) {
            StateNode working = active.state("Working");
            active.arrow(active.start(), working);
            try (StateScope inner = active.composite("Inner")) {
                inner.state("Deep");
            }
        }

        assertThat(renderer.render(d.build())).isEqualTo(String.join("\n",
                "@startuml",
                "state Active {",
                "  state Working",
                "  [*] --> Working",
                "  state Inner {",
                "    state Deep",
                "  }",
                "}",
                "@enduml"));
    }

    @Test
    void separatesConcurrentRegionsWithoutSurroundingThem() {
        try (StateScope running = d.concurrent("Running", StateOptions.NONE, RegionSeparator.VERTICAL)) {
            for (String name : List.of("A", "B", "C")) {
                try (StateScope region = running.region()) {
                    region.state(name);
                }
            }
        }

        assertThat(renderer.render(d.build())).isEqualTo(String.join("\n",
                "@startuml",
                "state Running {",
                "  state A",
                "  ||",
                "  state B",
                "  ||",
                "  state C",
                "}",
                "@enduml"));
    }

    @Test
    void arrowCarriesDirectionStyleAndLabelPartsInOrder() {
        StateNode a = d.state("A");
        StateNode b = d.state("B");
        d.arrow(a, b, TransitionOptions.NONE
                .withDirection(Direction.RIGHT)
                .withStyle(LineStyle.of(LinePattern.DASHED).withColor(Color.named("red")))
                .withTrigger("evt")
                .withGuard("ok")
                .withEffect("log()")
                .withNote("why"));

        assertThat(lines(renderer.render(d.build()))).containsSubsequence(
                "A -r[#red,dashed]-> B : evt [ok] / log()",
                "note on link: why");
    }

    @Test
    void historyMarkersUseTheirTokens() {
        StateNode resume = d.state("Resume");
        d.arrow(resume, d.history());
        d.arrow(resume, d.deepHistory(), "deep");
        d.arrow(resume, d.end());

        assertThat(lines(renderer.render(d.build()))).contains(
                "Resume --> [H]",
                "Resume --> [H*] : deep",
                "Resume --> [*]");
    }

    @Test
    void declarationCarriesAliasStereotypeStyleDescriptionAndNote() {
        d.state("Waiting Room", StateOptions.alias("wr")
                .withDescription("idle \"time\"")
                .withStyle(Style.background(Color.named("pink")).withStereotype(Stereotype.of("queue")))
                .withNote("holds callers"));

        assertThat(lines(renderer.render(d.build()))).containsSubsequence(
                "state \"Waiting Room\" as wr <<queue>> #pink",
                "wr : idle <U+0022>time<U+0022>",
                "note right of wr: holds callers");
    }

    @Test
    void namedPseudoStatesDeclareTheirKind() {
        d.choice("check");
        d.choice("route?");
        d.entryPoint("in");

        assertThat(lines(renderer.render(d.build()))).containsSubsequence(
                "state check <<choice>>",
                "state \"route?\" as route <<choice>>",
                "state in <<entryPoint>>");
    }

    @Test
    void implicitMarkersDeclareNothing() {
        StateDiagram diagram = new StateDiagram(List.of(PseudoState.INITIAL, PseudoState.FINAL), DiagramMetadata.EMPTY);

        assertThat(renderer.render(diagram)).isEqualTo("@startuml\n@enduml");
    }

    @Test
    void rendersNotesByPosition() {
        StateNode idle = d.state("Idle");
        d.note("top level");
        d.note("line one\nline two", NotePosition.FLOATING);
        d.noteOf(idle, "waiting\nfor input", NotePosition.LEFT);

        assertThat(renderer.render(d.build())).isEqualTo(String.join("\n",
                "@startuml",
                "state Idle",
                "note right: top level",
                "note as N0",
                "  line one",
                "  line two",
                "end note",
                "note left of Idle",
                "  waiting",
                "  for input",
                "end note",
                "@enduml"));
    }

    @Test
    void honoursIndentWidthAndLineSeparator() {
        try (StateScope active = d.composite("Active")) {
            active.state("Working");
        }

        String text = new StateDiagramRenderer(new RenderOptions(4, "\r\n")).render(d.build());

        assertThat(text).isEqualTo("@startuml\r\nstate Active {\r\n    state Working\r\n}\r\n@enduml");
    }

    @Test
    void unknownElementTypeIsAnInternalFault() {
        StateDiagramElement stranger = new StateDiagramElement() {
        };
        StateDiagram diagram = new StateDiagram(List.of(stranger), DiagramMetadata.EMPTY);

        assertThat(catchThrowable(() -> renderer.render(diagram))).isInstanceOf(IllegalStateException.class);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n"));
    }
}
