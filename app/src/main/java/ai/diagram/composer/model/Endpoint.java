package ai.diagram.composer.model;

/**
 * Anything a transition or an anchored note can point at.
 *
 * <p>Built handles ({@link StateNode}, {@link PseudoState}, {@link CompositeState}, {@link ConcurrentState})
 * carry their identity and are trusted as-is. A {@link RawIdentity} is a caller-typed string and has to be
 * resolved against the reference registry before use.
 */
public interface Endpoint {

    String identity();

    static Endpoint of(String identity) {
        return new RawIdentity(identity);
    }
}
