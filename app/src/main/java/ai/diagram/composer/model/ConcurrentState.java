package ai.diagram.composer.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A state made of orthogonal regions that run side by side.
 */
public record ConcurrentState(
        String name,
        Optional<String> alias,
        List<Region> regions,
        Optional<Style> style,
        Optional<Note> note,
        RegionSeparator separator
) implements StateLike {

    public ConcurrentState {
        name = Identities.requireName(name, "concurrent state");
        alias = alias == null ? Optional.empty() : alias.filter(value -> !value.isBlank());
        regions = regions == null ? List.of() : List.copyOf(regions);
        style = style == null ? Optional.empty() : style;
        note = note == null ? Optional.empty() : note;
        separator = Objects.requireNonNull(separator, "separator");
    }
}
