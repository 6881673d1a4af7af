package ai.diagram.composer.model;

import java.util.Objects;

public record Header(String content, HorizontalAlignment alignment) {

    public Header {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("header content must not be blank");
        }
        alignment = Objects.requireNonNullElse(alignment, HorizontalAlignment.LEFT);
    }
}
