package ai.diagram.composer.model;

import java.util.List;
import java.util.Optional;

/**
 * A state owning an ordered sequence of nested elements.
 */
public record CompositeState(
        String name,
        Optional<String> alias,
        List<StateDiagramElement> elements,
        Optional<Style> style,
        Optional<Note> note
) implements StateLike {

    public CompositeState {
        name = Identities.requireName(name, "composite state");
        alias = alias == null ? Optional.empty() : alias.filter(value -> !value.isBlank());
        elements = elements == null ? List.of() : List.copyOf(elements);
        style = style == null ? Optional.empty() : style;
        note = note == null ? Optional.empty() : note;
    }
}
