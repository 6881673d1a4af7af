package ai.diagram.composer.error;

/**
 * Base type for caller mistakes detected while a diagram is being assembled.
 *
 * <p>All subclasses are raised synchronously at the offending call; nothing is committed to the enclosing scope
 * when one is thrown, so the caller fixes the call sequence and runs it again.
 */
public class DiagramDefinitionException extends RuntimeException {

    public DiagramDefinitionException(String message) {
        super(message);
    }
}
