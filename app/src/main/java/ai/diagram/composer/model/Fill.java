package ai.diagram.composer.model;

/**
 * A background paint: a plain {@link Color} or a {@link Gradient}.
 */
public interface Fill {
}
