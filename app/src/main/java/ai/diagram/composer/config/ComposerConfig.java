package ai.diagram.composer.config;

import ai.diagram.composer.model.RegionSeparator;
import ai.diagram.composer.render.RenderOptions;
import java.util.Objects;

/**
 * Immutable runtime settings resolved from the environment.
 */
public record ComposerConfig(
        RenderOptions renderOptions,
        RegionSeparator regionSeparator,
        boolean hideEmptyDescription,
        LogFormat logFormat
) {

    public static final ComposerConfig DEFAULT =
            new ComposerConfig(RenderOptions.DEFAULT, RegionSeparator.HORIZONTAL, false, LogFormat.TEXT);

    public ComposerConfig {
        Objects.requireNonNull(renderOptions, "renderOptions");
        Objects.requireNonNull(regionSeparator, "regionSeparator");
        Objects.requireNonNull(logFormat, "logFormat");
    }
}
