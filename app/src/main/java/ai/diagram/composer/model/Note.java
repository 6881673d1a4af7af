package ai.diagram.composer.model;

import ai.diagram.composer.error.EmptyContentException;
import java.util.Objects;
import java.util.Optional;

/**
 * Free text either attached to an identity ({@code anchor}) or placed on its own.
 */
public record Note(String content, NotePosition position, Optional<String> anchor) implements StateDiagramElement {

    public Note {
        if (content == null || content.isBlank()) {
            throw new EmptyContentException("note content must not be blank");
        }
        Objects.requireNonNull(position, "position");
        anchor = anchor == null ? Optional.empty() : anchor;
        if (anchor.isPresent() && !position.isAnchorable()) {
            throw new IllegalArgumentException("Note position '" + position.keyword()
                    + "' cannot be anchored to a state. Use LEFT, RIGHT, TOP or BOTTOM.");
        }
    }

    public static Note of(String content) {
        return new Note(content, NotePosition.RIGHT, Optional.empty());
    }

    public static Note of(String content, NotePosition position) {
        return new Note(content, position, Optional.empty());
    }
}
