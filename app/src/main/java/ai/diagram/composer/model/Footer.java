package ai.diagram.composer.model;

import java.util.Objects;

/**
 * Page footer; the text may contain {@code %page%} style variables, passed through untouched.
 */
public record Footer(String content, HorizontalAlignment alignment) {

    public Footer {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("footer content must not be blank");
        }
        alignment = Objects.requireNonNullElse(alignment, HorizontalAlignment.LEFT);
    }
}
