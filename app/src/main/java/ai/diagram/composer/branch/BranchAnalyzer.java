package ai.diagram.composer.branch;

import ai.diagram.composer.error.AmbiguousExitException;
import ai.diagram.composer.error.EmptyBranchException;
import ai.diagram.composer.model.StateDiagramElement;
import ai.diagram.composer.model.StateLike;
import ai.diagram.composer.model.Transition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the branches of a parallel block into a fork bar, one entry and one exit edge per branch, and a join bar.
 *
 * <p>The entry of a branch is its first declared state. The exit is the only state that never appears as the source
 * of a transition declared directly in the branch. When every state has an outgoing transition (a cycle), the last
 * declared state is used. When several states qualify the branch is rejected instead of guessing.
 */
public class BranchAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BranchAnalyzer.class);

    public ParallelExpansion expand(ForkJoinNames names, List<List<StateDiagramElement>> branches) {
        Objects.requireNonNull(names, "names");
        if (branches == null || branches.isEmpty()) {
            throw new EmptyBranchException("Parallel block '" + names.prefix()
                    + "' needs at least one branch; open one with branch() inside the block");
        }

        List<BranchEndpoints> endpoints = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            endpoints.add(analyze(branches.get(i), i));
        }

        String forkIdentity = names.forkIdentity();
        String joinIdentity = names.joinIdentity();
        List<StateDiagramElement> elements = new ArrayList<>();
        elements.add(names.fork());
        for (int i = 0; i < branches.size(); i++) {
            BranchEndpoints branch = endpoints.get(i);
            elements.add(Transition.between(forkIdentity, branch.entry()));
            elements.addAll(branches.get(i));
            elements.add(Transition.between(branch.exit(), joinIdentity));
        }
        elements.add(names.join());

        LOGGER.debug("Expanded parallel block {} into {} branches", names.prefix(), branches.size());
        return new ParallelExpansion(names.fork(), names.join(), endpoints, elements);
    }

    public BranchEndpoints analyze(List<StateDiagramElement> branch, int index) {
        List<String> states = new ArrayList<>();
        Set<String> sources = new HashSet<>();
        if (branch != null) {
            for (StateDiagramElement element : branch) {
                if (element instanceof StateLike state) {
                    states.add(state.identity());
                } else if (element instanceof Transition transition) {
                    sources.add(transition.source());
                }
            }
        }
        if (states.isEmpty()) {
            throw new EmptyBranchException("Branch " + (index + 1)
                    + " needs at least one element; declare a state inside the branch");
        }

        String entry = states.get(0);
        List<String> candidates = states.stream()
                .filter(identity -> !sources.contains(identity))
                .distinct()
                .toList();
        String exit;
        if (candidates.isEmpty()) {
            exit = states.get(states.size() - 1);
            LOGGER.debug("Branch {} has no state without outgoing transitions; using last declared state {} as exit",
                    index + 1, exit);
        } else if (candidates.size() == 1) {
            exit = candidates.get(0);
        } else {
            throw new AmbiguousExitException(index, candidates);
        }
        LOGGER.debug("Branch {} enters at {} and exits at {}", index + 1, entry, exit);
        return new BranchEndpoints(entry, exit);
    }
}
