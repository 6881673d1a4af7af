package ai.diagram.composer.render;

import ai.diagram.composer.model.CompositeState;
import ai.diagram.composer.model.ConcurrentState;
import ai.diagram.composer.model.Note;
import ai.diagram.composer.model.NotePosition;
import ai.diagram.composer.model.PseudoState;
import ai.diagram.composer.model.Region;
import ai.diagram.composer.model.StateDiagram;
import ai.diagram.composer.model.StateDiagramElement;
import ai.diagram.composer.model.StateLike;
import ai.diagram.composer.model.StateNode;
import ai.diagram.composer.model.Style;
import ai.diagram.composer.model.Transition;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a {@link StateDiagram} to PlantUML text. Instances hold no per-call state and can be shared.
 */
public class StateDiagramRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StateDiagramRenderer.class);

    static final String START_MARKER = "@startuml";
    static final String END_MARKER = "@enduml";

    private final RenderOptions options;
    private final StyleRenderer styles;
    private final MetadataRenderer metadata;

    public StateDiagramRenderer() {
        this(RenderOptions.DEFAULT);
    }

    public StateDiagramRenderer(RenderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.styles = new StyleRenderer();
        this.metadata = new MetadataRenderer(styles, options);
    }

    public String render(StateDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram");
        List<String> lines = new ArrayList<>();
        lines.add(START_MARKER);
        lines.addAll(metadata.render(diagram.metadata()));
        Pass pass = new Pass();
        for (StateDiagramElement element : diagram.elements()) {
            lines.addAll(pass.element(element));
        }
        lines.add(END_MARKER);
        LOGGER.debug("Rendered {} top-level elements into {} lines", diagram.elements().size(), lines.size());
        return String.join(options.lineSeparator(), lines);
    }

    /**
     * One serialization run. Floating note ids are numbered per run so repeated renders match.
     */
    private final class Pass {

        private int floatingNotes;

        List<String> element(StateDiagramElement element) {
            if (element instanceof StateNode state) {
                return state(state);
            }
            if (element instanceof PseudoState pseudo) {
                return pseudoState(pseudo);
            }
            if (element instanceof CompositeState composite) {
                return composite(composite);
            }
            if (element instanceof ConcurrentState concurrent) {
                return concurrent(concurrent);
            }
            if (element instanceof Transition transition) {
                return transition(transition);
            }
            if (element instanceof Note note) {
                return note(note);
            }
            throw new IllegalStateException("Unsupported diagram element: "
                    + (element == null ? "null" : element.getClass().getName()));
        }

        private List<String> state(StateNode state) {
            List<String> lines = new ArrayList<>();
            lines.add(declaration(state, state.style()));
            state.description().ifPresent(description ->
                    lines.add(state.identity() + " : " + PlantUmlText.escapeQuotes(description)));
            state.note().ifPresent(note -> lines.addAll(attachedNote(note, state.identity())));
            return lines;
        }

        private List<String> pseudoState(PseudoState pseudo) {
            if (pseudo.kind().isImplicit()) {
                return List.of();
            }
            String name = pseudo.name().orElse(pseudo.identity());
            StringBuilder line = new StringBuilder("state ")
                    .append(PlantUmlText.declaredName(name, pseudo.identity(), false))
                    .append(" <<").append(pseudo.kind().token()).append(">>");
            pseudo.style().map(styles::inline).filter(text -> !text.isEmpty())
                    .ifPresent(text -> line.append(' ').append(text));
            return List.of(line.toString());
        }

        private List<String> composite(CompositeState composite) {
            List<String> lines = new ArrayList<>();
            lines.add(declaration(composite, composite.style()) + " {");
            for (StateDiagramElement child : composite.elements()) {
                lines.addAll(indented(element(child)));
            }
            lines.add("}");
            composite.note().ifPresent(note -> lines.addAll(attachedNote(note, composite.identity())));
            return lines;
        }

        private List<String> concurrent(ConcurrentState concurrent) {
            List<String> lines = new ArrayList<>();
            lines.add(declaration(concurrent, concurrent.style()) + " {");
            List<Region> regions = concurrent.regions();
            for (int index = 0; index < regions.size(); index++) {
                if (index > 0) {
                    lines.add(options.indent() + concurrent.separator().token());
                }
                Region region = regions.get(index);
                region.name().ifPresent(name -> lines.add(options.indent() + "' " + name));
                for (StateDiagramElement child : region.elements()) {
                    lines.addAll(indented(element(child)));
                }
            }
            lines.add("}");
            concurrent.note().ifPresent(note -> lines.addAll(attachedNote(note, concurrent.identity())));
            return lines;
        }

        private List<String> transition(Transition transition) {
            StringBuilder arrow = new StringBuilder("-");
            transition.direction().ifPresent(direction -> arrow.append(direction.letter()));
            transition.style().map(styles::lineBracket).ifPresent(arrow::append);
            arrow.append("->");

            StringBuilder line = new StringBuilder()
                    .append(PlantUmlText.endpoint(transition.source()))
                    .append(' ').append(arrow).append(' ')
                    .append(PlantUmlText.endpoint(transition.target()));

            List<String> label = new ArrayList<>();
            transition.label().ifPresent(label::add);
            transition.trigger().ifPresent(label::add);
            transition.guard().ifPresent(guard -> label.add("[" + guard + "]"));
            transition.effect().ifPresent(effect -> label.add("/ " + effect));
            if (!label.isEmpty()) {
                line.append(" : ").append(PlantUmlText.escapeQuotes(String.join(" ", label)));
            }

            List<String> lines = new ArrayList<>();
            lines.add(line.toString());
            transition.note().ifPresent(note -> lines.addAll(noteLines("note on link", note)));
            return lines;
        }

        private List<String> note(Note note) {
            if (note.anchor().isPresent()) {
                return attachedNote(note, note.anchor().get());
            }
            if (note.position() == NotePosition.FLOATING) {
                String id = "N" + floatingNotes++;
                if (PlantUmlText.isMultiline(note.content())) {
                    return block("note as " + id, note.content(), "end note");
                }
                return List.of("note \"" + PlantUmlText.escapeQuotes(note.content()) + "\" as " + id);
            }
            return noteLines("note " + note.position().keyword(), note.content());
        }

        private List<String> attachedNote(Note note, String identity) {
            return noteLines("note " + note.position().keyword() + " of " + identity, note.content());
        }

        private List<String> noteLines(String opening, String content) {
            if (PlantUmlText.isMultiline(content)) {
                return block(opening, content, "end note");
            }
            return List.of(opening + ": " + PlantUmlText.escapeQuotes(content));
        }
    }

    private String declaration(StateLike state, Optional<Style> style) {
        StringBuilder line = new StringBuilder("state ")
                .append(PlantUmlText.declaredName(state.name(), state.identity(), state.alias().isPresent()));
        style.flatMap(Style::stereotype).ifPresent(stereotype -> line.append(' ').append(styles.stereotype(stereotype)));
        style.map(styles::inline).filter(text -> !text.isEmpty()).ifPresent(text -> line.append(' ').append(text));
        return line.toString();
    }

    private List<String> block(String opening, String content, String closing) {
        List<String> lines = new ArrayList<>();
        lines.add(opening);
        for (String line : PlantUmlText.escapeQuotes(content).split("\n", -1)) {
            lines.add(options.indent() + line);
        }
        lines.add(closing);
        return lines;
    }

    private List<String> indented(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(options.indent() + line);
        }
        return result;
    }
}
