package ai.diagram.composer.branch;

import ai.diagram.composer.model.PseudoState;
import ai.diagram.composer.model.StateDiagramElement;
import java.util.List;
import java.util.Objects;

/**
 * Result of wiring a parallel block: the synthesized bars, the inferred endpoints of each branch and the flat element
 * sequence to append to the enclosing scope.
 */
public record ParallelExpansion(
        PseudoState fork,
        PseudoState join,
        List<BranchEndpoints> branches,
        List<StateDiagramElement> elements
) {

    public ParallelExpansion {
        Objects.requireNonNull(fork, "fork");
        Objects.requireNonNull(join, "join");
        branches = List.copyOf(branches);
        elements = List.copyOf(elements);
    }
}
