package ai.diagram.composer.error;

/**
 * Required free text, such as note content, was blank.
 */
public class EmptyContentException extends DiagramDefinitionException {

    public EmptyContentException(String message) {
        super(message);
    }
}
