package ai.diagram.composer.model;

import java.util.Optional;

/**
 * A simple state.
 */
public record StateNode(
        String name,
        Optional<String> alias,
        Optional<String> description,
        Optional<Style> style,
        Optional<Note> note
) implements StateLike {

    public StateNode {
        name = Identities.requireName(name, "state");
        alias = alias == null ? Optional.empty() : alias.filter(value -> !value.isBlank());
        description = description == null ? Optional.empty() : description;
        style = style == null ? Optional.empty() : style;
        note = note == null ? Optional.empty() : note;
    }

    public static StateNode of(String name) {
        return new StateNode(name, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }
}
