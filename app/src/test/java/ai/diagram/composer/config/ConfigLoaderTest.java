package ai.diagram.composer.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.diagram.composer.model.RegionSeparator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsWhenEnvironmentIsEmpty() {
        ComposerConfig config = new ConfigLoader(key -> Optional.empty()).load();

        assertThat(config.renderOptions().indentWidth()).isEqualTo(2);
        assertThat(config.renderOptions().lineSeparator()).isEqualTo("\n");
        assertThat(config.regionSeparator()).isEqualTo(RegionSeparator.HORIZONTAL);
        assertThat(config.hideEmptyDescription()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config).isEqualTo(ComposerConfig.DEFAULT);
    }

    @Test
    void readsOverridesFromEnvironment() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_INDENT_WIDTH, " 4 ");
        envValues.put(ConfigLoader.ENV_LINE_ENDING, "CRLF");
        envValues.put(ConfigLoader.ENV_REGION_SEPARATOR, "vertical");
        envValues.put(ConfigLoader.ENV_HIDE_EMPTY_DESCRIPTION, "1");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);

        ComposerConfig config = new ConfigLoader(environmentReader).load();

        assertThat(config.renderOptions().indentWidth()).isEqualTo(4);
        assertThat(config.renderOptions().lineSeparator()).isEqualTo("\r\n");
        assertThat(config.regionSeparator()).isEqualTo(RegionSeparator.VERTICAL);
        assertThat(config.hideEmptyDescription()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).contains(
                ConfigLoader.ENV_INDENT_WIDTH,
                ConfigLoader.ENV_LINE_ENDING,
                ConfigLoader.ENV_REGION_SEPARATOR,
                ConfigLoader.ENV_HIDE_EMPTY_DESCRIPTION,
                ConfigLoader.ENV_LOG_FORMAT);
    }

    @Test
    void systemReaderSeesProcessEnvironment() {
        EnvironmentReader environmentReader = EnvironmentReader.system();

        assertThat(environmentReader.get("DIAGRAM_COMPOSER_UNSET_VARIABLE_FOR_TESTS")).isEmpty();
        System.getenv().entrySet().stream().findFirst().ifPresent(entry ->
                assertThat(environmentReader.get(entry.getKey())).contains(entry.getValue()));
    }

    @Test
    void blankValuesFallBackToDefaults() {
        ComposerConfig config = new ConfigLoader(key -> Optional.of("   ")).load();

        assertThat(config).isEqualTo(ComposerConfig.DEFAULT);
    }

    @Test
    void rejectsIndentWidthOutOfRange() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(only(ConfigLoader.ENV_INDENT_WIDTH, "12")).load());

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_INDENT_WIDTH);
    }

    @Test
    void rejectsNonNumericIndentWidth() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(only(ConfigLoader.ENV_INDENT_WIDTH, "wide")).load());

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_INDENT_WIDTH)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void rejectsUnknownEnumValuesNamingTheVariable() {
        assertThat(catchThrowable(() -> new ConfigLoader(only(ConfigLoader.ENV_LINE_ENDING, "cr")).load()))
                .hasMessageContaining(ConfigLoader.ENV_LINE_ENDING);
        assertThat(catchThrowable(() -> new ConfigLoader(only(ConfigLoader.ENV_REGION_SEPARATOR, "diagonal")).load()))
                .hasMessageContaining(ConfigLoader.ENV_REGION_SEPARATOR);
        assertThat(catchThrowable(() -> new ConfigLoader(only(ConfigLoader.ENV_LOG_FORMAT, "xml")).load()))
                .hasMessageContaining(ConfigLoader.ENV_LOG_FORMAT);
    }

    @Test
    void logFormatParsingIsCaseInsensitive() {
        assertThat(LogFormat.from(" Json ")).isEqualTo(LogFormat.JSON);
        assertThat(catchThrowable(() -> LogFormat.from(""))).isInstanceOf(IllegalArgumentException.class);
    }

    private static EnvironmentReader only(String key, String value) {
        return requested -> requested.equals(key) ? Optional.of(value) : Optional.empty();
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {
        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
