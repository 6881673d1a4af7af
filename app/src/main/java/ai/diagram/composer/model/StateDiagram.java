package ai.diagram.composer.model;

import java.util.List;
import java.util.Objects;

/**
 * Root aggregate: the finished, immutable diagram handed to the renderer.
 */
public record StateDiagram(List<StateDiagramElement> elements, DiagramMetadata metadata) {

    public StateDiagram {
        elements = elements == null ? List.of() : List.copyOf(elements);
        Objects.requireNonNull(metadata, "metadata");
    }
}
