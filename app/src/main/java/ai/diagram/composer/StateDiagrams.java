package ai.diagram.composer;

import ai.diagram.composer.builder.StateDiagramBuilder;
import ai.diagram.composer.config.ComposerConfig;
import ai.diagram.composer.config.ConfigLoader;
import ai.diagram.composer.config.EnvironmentReader;
import ai.diagram.composer.logging.LoggingConfigurator;
import ai.diagram.composer.model.StateDiagram;
import ai.diagram.composer.registry.SequentialTokenGenerator;
import ai.diagram.composer.render.StateDiagramRenderer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point tying configuration, the builder and the renderer together.
 *
 * <pre>{@code
 * StateDiagrams diagrams = StateDiagrams.fromEnvironment();
 * StateDiagramBuilder d = diagrams.newDiagram();
 * d.arrow(d.start(), d.state("Idle"));
 * String text = diagrams.render(d.build());
 * }</pre>
 */
public final class StateDiagrams {

    private static final Logger LOGGER = LoggerFactory.getLogger(StateDiagrams.class);

    private final ComposerConfig config;
    private final StateDiagramRenderer renderer;

    public StateDiagrams(ComposerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.renderer = new StateDiagramRenderer(config.renderOptions());
    }

    public static StateDiagrams withDefaults() {
        return new StateDiagrams(ComposerConfig.DEFAULT);
    }

    public static StateDiagrams fromEnvironment() {
        return fromEnvironment(EnvironmentReader.system());
    }

    /**
     * Loads the configuration and applies its log format to the logging backend.
     */
    public static StateDiagrams fromEnvironment(EnvironmentReader environmentReader) {
        ComposerConfig config = new ConfigLoader(environmentReader).load();
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.debug("Loaded configuration {}", config);
        return new StateDiagrams(config);
    }

    public ComposerConfig config() {
        return config;
    }

    /**
     * A fresh builder session carrying the configured region separator and description visibility.
     */
    public StateDiagramBuilder newDiagram() {
        return StateDiagramBuilder.create(new SequentialTokenGenerator(), config.regionSeparator())
                .hideEmptyDescription(config.hideEmptyDescription());
    }

    public String render(StateDiagram diagram) {
        return renderer.render(diagram);
    }
}
