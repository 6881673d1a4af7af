package ai.diagram.composer.error;

import java.util.List;

/**
 * More than one state of a parallel branch could be its exit.
 */
public class AmbiguousExitException extends DiagramDefinitionException {

    private final int branchIndex;
    private final List<String> candidates;

    public AmbiguousExitException(int branchIndex, List<String> candidates) {
        super("Branch " + (branchIndex + 1) + " has several states without outgoing transitions: "
                + String.join(", ", candidates)
                + ". Connect them so that exactly one state is left without an outgoing transition");
        this.branchIndex = branchIndex;
        this.candidates = List.copyOf(candidates);
    }

    public int branchIndex() {
        return branchIndex;
    }

    public List<String> candidates() {
        return candidates;
    }
}
