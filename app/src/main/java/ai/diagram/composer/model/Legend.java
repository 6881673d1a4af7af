package ai.diagram.composer.model;

import java.util.Objects;

public record Legend(String content, LegendPosition position) {

    public Legend {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("legend content must not be blank");
        }
        position = Objects.requireNonNullElse(position, LegendPosition.RIGHT);
    }
}
