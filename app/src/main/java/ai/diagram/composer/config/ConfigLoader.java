package ai.diagram.composer.config;

import ai.diagram.composer.model.RegionSeparator;
import ai.diagram.composer.render.RenderOptions;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds a {@link ComposerConfig} from environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INDENT_WIDTH = "DIAGRAM_INDENT_WIDTH";
    static final String ENV_LINE_ENDING = "DIAGRAM_LINE_ENDING";
    static final String ENV_REGION_SEPARATOR = "DIAGRAM_REGION_SEPARATOR";
    static final String ENV_HIDE_EMPTY_DESCRIPTION = "DIAGRAM_HIDE_EMPTY_DESCRIPTION";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final int MAX_INDENT_WIDTH = 8;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public ComposerConfig load() {
        int indentWidth = environmentReader.value(ENV_INDENT_WIDTH)
                .map(ConfigLoader::parseIndentWidth)
                .orElse(RenderOptions.DEFAULT.indentWidth());

        String lineSeparator = environmentReader.value(ENV_LINE_ENDING)
                .map(ConfigLoader::parseLineEnding)
                .orElse(RenderOptions.DEFAULT.lineSeparator());

        RegionSeparator regionSeparator = environmentReader.value(ENV_REGION_SEPARATOR)
                .map(ConfigLoader::parseRegionSeparator)
                .orElse(RegionSeparator.HORIZONTAL);

        boolean hideEmptyDescription = environmentReader.value(ENV_HIDE_EMPTY_DESCRIPTION)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);

        LogFormat logFormat = environmentReader.value(ENV_LOG_FORMAT)
                .map(ConfigLoader::parseLogFormat)
                .orElse(LogFormat.TEXT);

        return new ComposerConfig(new RenderOptions(indentWidth, lineSeparator), regionSeparator,
                hideEmptyDescription, logFormat);
    }

    private static int parseIndentWidth(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0 || value > MAX_INDENT_WIDTH) {
                throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be between 0 and " + MAX_INDENT_WIDTH);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be an integer", ex);
        }
    }

    private static String parseLineEnding(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "lf" -> "\n";
            case "crlf" -> "\r\n";
            default -> throw new IllegalArgumentException(ENV_LINE_ENDING + " must be 'lf' or 'crlf': " + raw);
        };
    }

    private static RegionSeparator parseRegionSeparator(String raw) {
        try {
            return RegionSeparator.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_REGION_SEPARATOR + " must be 'horizontal' or 'vertical': " + raw, ex);
        }
    }

    private static LogFormat parseLogFormat(String raw) {
        try {
            return LogFormat.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_LOG_FORMAT + " must be 'text' or 'json': " + raw, ex);
        }
    }
}
