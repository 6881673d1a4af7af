package ai.diagram.composer.model;

import java.util.Optional;

/**
 * A stable state: a plain state node or a container. These are the elements a parallel branch can enter and leave.
 */
public interface StateLike extends StateDiagramElement, Endpoint {

    String name();

    Optional<String> alias();

    Optional<Style> style();

    Optional<Note> note();

    @Override
    default String identity() {
        return Identities.derive(name(), alias().orElse(null));
    }
}
