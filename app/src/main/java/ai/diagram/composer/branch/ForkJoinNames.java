package ai.diagram.composer.branch;

import ai.diagram.composer.model.Identities;
import ai.diagram.composer.model.PseudoState;
import ai.diagram.composer.model.PseudoStateKind;

/**
 * Names of the fork and join bars surrounding one parallel block.
 */
public record ForkJoinNames(String prefix) {

    public ForkJoinNames {
        prefix = Identities.sanitize(Identities.requireName(prefix, "parallel block"));
    }

    public static ForkJoinNames named(String name) {
        return new ForkJoinNames(name);
    }

    public static ForkJoinNames generated(String token) {
        return new ForkJoinNames(token);
    }

    public String forkIdentity() {
        return prefix + "_fork";
    }

    public String joinIdentity() {
        return prefix + "_join";
    }

    public PseudoState fork() {
        return PseudoState.named(PseudoStateKind.FORK, forkIdentity());
    }

    public PseudoState join() {
        return PseudoState.named(PseudoStateKind.JOIN, joinIdentity());
    }
}
