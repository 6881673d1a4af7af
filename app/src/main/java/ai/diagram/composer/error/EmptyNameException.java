package ai.diagram.composer.error;

/**
 * A required name or reference was blank.
 */
public class EmptyNameException extends DiagramDefinitionException {

    public EmptyNameException(String message) {
        super(message);
    }
}
