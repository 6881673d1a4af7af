package ai.diagram.composer.builder;

import java.util.Locale;

/**
 * Kind of construction scope a {@link StateScope} handle stands for.
 */
public enum ScopeKind {
    DIAGRAM,
    COMPOSITE,
    CONCURRENT,
    REGION,
    PARALLEL,
    BRANCH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the scope itself becomes a state that transitions can target.
     */
    public boolean isState() {
        return this == COMPOSITE || this == CONCURRENT;
    }
}
