package ai.diagram.composer.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import ai.diagram.composer.error.AmbiguousExitException;
import ai.diagram.composer.error.EmptyBranchException;
import ai.diagram.composer.error.IdentityCollisionException;
import ai.diagram.composer.error.StructuralMisuseException;
import ai.diagram.composer.model.PseudoState;
import ai.diagram.composer.model.PseudoStateKind;
import ai.diagram.composer.model.StateDiagramElement;
import ai.diagram.composer.model.StateNode;
import ai.diagram.composer.model.Transition;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParallelScopeTest {

    private final StateDiagramBuilder d = StateDiagramBuilder.create();

    @Test
    void wiresForkEntryExitAndJoinPerBranch() {
        try (StateScope checks = d.parallel("checks")) {
            try (StateScope fraud = checks.branch()) {
                fraud.state("FraudCheck");
            }
            try (StateScope balance = checks.branch()) {
                StateNode balanceCheck = balance.state("BalanceCheck");
                StateNode hold = balance.state("Hold");
                balance.arrow(balanceCheck, hold);
            }
        }

        List<StateDiagramElement> elements = d.build().elements();

        assertThat(elements).containsExactly(
                PseudoState.named(PseudoStateKind.FORK, "checks_fork"),
                Transition.between("checks_fork", "FraudCheck"),
                StateNode.of("FraudCheck"),
                Transition.between("FraudCheck", "checks_join"),
                Transition.between("checks_fork", "BalanceCheck"),
                StateNode.of("BalanceCheck"),
                StateNode.of("Hold"),
                Transition.between("BalanceCheck", "Hold"),
                Transition.between("Hold", "checks_join"),
                PseudoState.named(PseudoStateKind.JOIN, "checks_join"));
    }

    @Test
    void forkJoinAndBranchStatesAreReferencableAfterClose() {
        StateNode received = d.state("Received");
        StateScope checks = d.parallel("checks");
        try (StateScope branch = checks.branch()) {
            branch.state("FraudCheck");
        }
        checks.close();
        StateNode approved = d.state("Approved");

        d.arrow(received, checks.forkNode());
        d.arrow(d.ref("checks_join"), approved);
        d.arrow(d.ref("FraudCheck"), d.end());

        List<Transition> transitions = d.build().elements().stream()
                .filter(Transition.class::isInstance)
                .map(Transition.class::cast)
                .toList();
        assertThat(transitions).extracting(Transition::source, Transition::target)
                .contains(
                        tuple("Received", "checks_fork"),
                        tuple("checks_join", "Approved"),
                        tuple("FraudCheck", "final"));
    }

    @Test
    void anonymousBlocksTakeTokensFromTheSession() {
        for (int i = 0; i < 2; i++) {
            try (StateScope parallel = d.parallel()) {
                try (StateScope branch = parallel.branch()) {
                    branch.state("Step" + i);
                }
            }
        }

        List<String> bars = d.build().elements().stream()
                .filter(PseudoState.class::isInstance)
                .map(element -> ((PseudoState) element).identity())
                .toList();

        assertThat(bars).containsExactly("parallel_1_fork", "parallel_1_join", "parallel_2_fork", "parallel_2_join");
    }

    @Test
    void injectedTokenGeneratorNamesAnonymousBlocks() {
        StateDiagramBuilder custom = StateDiagramBuilder.create(() -> "batch");
        StateScope parallel = custom.parallel();

        assertThat(parallel.forkNode().identity()).isEqualTo("batch_fork");
        assertThat(parallel.joinNode().identity()).isEqualTo("batch_join");
    }

    @Test
    void unconnectedBranchStatesAreAmbiguous() {
        StateScope parallel = d.parallel("p");
        try (StateScope branch = parallel.branch()) {
            branch.states("A", "B");
        }

        Throwable thrown = catchThrowable(parallel::close);

        assertThat(thrown).isInstanceOf(AmbiguousExitException.class)
                .hasMessageContaining("A")
                .hasMessageContaining("B");
        assertThat(((AmbiguousExitException) thrown).candidates()).containsExactly("A", "B");
        assertThat(d.build().elements()).isEmpty();
    }

    @Test
    void parallelWithoutBranchesFailsOnClose() {
        StateScope parallel = d.parallel("empty");

        assertThat(catchThrowable(parallel::close)).isInstanceOf(EmptyBranchException.class);
        assertThat(parallel.isClosed()).isTrue();
    }

    @Test
    void emptyBranchFailsWhenTheBlockCloses() {
        StateScope parallel = d.parallel("p");
        parallel.branch().close();

        Throwable thrown = catchThrowable(parallel::close);

        assertThat(thrown).isInstanceOf(EmptyBranchException.class).hasMessageContaining("Branch 1");
    }

    @Test
    void forkIdentityMustNotCollideWithDeclaredState() {
        d.state("checks_fork");
        StateScope parallel = d.parallel("checks");
        try (StateScope branch = parallel.branch()) {
            branch.state("Only");
        }

        Throwable thrown = catchThrowable(parallel::close);

        assertThat(thrown).isInstanceOf(IdentityCollisionException.class).hasMessageContaining("checks_fork");
    }

    @Test
    void parallelBlockOnlyOpensBranches() {
        StateScope parallel = d.parallel("p");

        Throwable thrown = catchThrowable(() -> parallel.state("Loose"));

        assertThat(thrown).isInstanceOf(StructuralMisuseException.class).hasMessageContaining("branch()");
    }

    @Test
    void branchesCannotHoldMarkersOrNestedParallelBlocks() {
        StateScope parallel = d.parallel("p");
        StateScope branch = parallel.branch();

        assertThat(catchThrowable(branch::start))
                .isInstanceOf(StructuralMisuseException.class)
                .hasMessageContaining("start() is not available in branch scope");
        assertThat(catchThrowable(() -> branch.parallel("inner")))
                .isInstanceOf(StructuralMisuseException.class);
    }

    @Test
    void branchMayContainCompositeStates() {
        try (StateScope parallel = d.parallel("p")) {
            try (StateScope branch = parallel.branch()) {
                try (StateScope review = branch.composite("Review")) {
                    StateNode reading = review.state("Reading");
                    review.arrow(review.start(), reading);
                }
                StateNode signed = branch.state("Signed");
                branch.arrow(branch.ref("Review"), signed);
            }
        }

        List<StateDiagramElement> elements = d.build().elements();

        assertThat(elements).contains(
                Transition.between("p_fork", "Review"),
                Transition.between("Signed", "p_join"));
    }
}
