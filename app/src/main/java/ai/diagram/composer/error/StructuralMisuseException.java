package ai.diagram.composer.error;

/**
 * An operation was invoked on a scope handle where it is not allowed, usually an outer handle while a nested
 * scope is still open.
 */
public class StructuralMisuseException extends DiagramDefinitionException {

    public StructuralMisuseException(String message) {
        super(message);
    }
}
