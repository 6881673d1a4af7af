package ai.diagram.composer.model;

import java.util.List;
import java.util.Optional;

/**
 * One orthogonal region of a {@link ConcurrentState}.
 */
public record Region(Optional<String> name, List<StateDiagramElement> elements) {

    public Region {
        name = name == null ? Optional.empty() : name.filter(value -> !value.isBlank());
        elements = elements == null ? List.of() : List.copyOf(elements);
    }
}
