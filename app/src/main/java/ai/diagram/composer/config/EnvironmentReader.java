package ai.diagram.composer.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    /**
     * Reads the process environment.
     */
    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    Optional<String> get(String key);

    /**
     * The trimmed value of {@code key}, empty when unset or blank.
     */
    default Optional<String> value(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
