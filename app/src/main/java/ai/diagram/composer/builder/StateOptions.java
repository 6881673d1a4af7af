package ai.diagram.composer.builder;

import ai.diagram.composer.model.Note;
import ai.diagram.composer.model.NotePosition;
import ai.diagram.composer.model.Style;
import java.util.Optional;

/**
 * Optional attributes for a state or container declaration.
 */
public record StateOptions(Optional<String> alias, Optional<String> description, Optional<Style> style, Optional<Note> note) {

    public static final StateOptions NONE = new StateOptions(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public StateOptions {
        alias = alias == null ? Optional.empty() : alias.filter(value -> !value.isBlank());
        description = description == null ? Optional.empty() : description.filter(value -> !value.isBlank());
        style = style == null ? Optional.empty() : style;
        note = note == null ? Optional.empty() : note;
        note.ifPresent(value -> {
            if (!value.position().isAnchorable() || value.anchor().isPresent()) {
                throw new IllegalArgumentException("A note attached to a state must be positioned LEFT, RIGHT, TOP or BOTTOM"
                        + " and must not name another anchor");
            }
        });
    }

    public static StateOptions alias(String alias) {
        return NONE.withAlias(alias);
    }

    public static StateOptions style(Style style) {
        return NONE.withStyle(style);
    }

    public static StateOptions description(String description) {
        return NONE.withDescription(description);
    }

    public StateOptions withAlias(String value) {
        return new StateOptions(Optional.ofNullable(value), description, style, note);
    }

    public StateOptions withDescription(String value) {
        return new StateOptions(alias, Optional.ofNullable(value), style, note);
    }

    public StateOptions withStyle(Style value) {
        return new StateOptions(alias, description, Optional.ofNullable(value), note);
    }

    public StateOptions withNote(String content) {
        return withNote(content, NotePosition.RIGHT);
    }

    public StateOptions withNote(String content, NotePosition position) {
        return withNote(Note.of(content, position));
    }

    public StateOptions withNote(Note value) {
        return new StateOptions(alias, description, style, Optional.ofNullable(value));
    }
}
