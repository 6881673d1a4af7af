package ai.diagram.composer.model;

import java.util.Optional;

/**
 * Output scaling. Maximum bounds win over exact dimensions, which win over a plain factor.
 */
public record Scale(
        Optional<Double> factor,
        Optional<Integer> width,
        Optional<Integer> height,
        Optional<Integer> maxWidth,
        Optional<Integer> maxHeight
) {

    public Scale {
        factor = factor == null ? Optional.empty() : factor;
        width = width == null ? Optional.empty() : width;
        height = height == null ? Optional.empty() : height;
        maxWidth = maxWidth == null ? Optional.empty() : maxWidth;
        maxHeight = maxHeight == null ? Optional.empty() : maxHeight;
        factor.ifPresent(value -> {
            if (value <= 0) {
                throw new IllegalArgumentException("scale factor must be greater than zero");
            }
        });
    }

    public static Scale factor(double factor) {
        return new Scale(Optional.of(factor), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static Scale size(Integer width, Integer height) {
        return new Scale(Optional.empty(), Optional.ofNullable(width), Optional.ofNullable(height),
                Optional.empty(), Optional.empty());
    }

    public static Scale max(Integer maxWidth, Integer maxHeight) {
        return new Scale(Optional.empty(), Optional.empty(), Optional.empty(),
                Optional.ofNullable(maxWidth), Optional.ofNullable(maxHeight));
    }
}
