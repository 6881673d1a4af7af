package ai.diagram.composer.error;

/**
 * A parallel block had no branch, or a branch declared no state to enter or leave.
 */
public class EmptyBranchException extends DiagramDefinitionException {

    public EmptyBranchException(String message) {
        super(message);
    }
}
