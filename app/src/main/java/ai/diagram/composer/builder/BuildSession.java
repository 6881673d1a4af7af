package ai.diagram.composer.builder;

import ai.diagram.composer.branch.BranchAnalyzer;
import ai.diagram.composer.model.RegionSeparator;
import ai.diagram.composer.registry.IdentityTokenGenerator;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * State shared by all scope handles of one diagram under construction: the stack of open scopes, the token
 * generator for anonymous parallel blocks and the branch analyzer. Not thread-safe; one session per thread.
 */
final class BuildSession {

    private final Deque<StateScope> openScopes = new ArrayDeque<>();
    private final IdentityTokenGenerator tokenGenerator;
    private final BranchAnalyzer branchAnalyzer;
    private final RegionSeparator defaultSeparator;

    BuildSession(IdentityTokenGenerator tokenGenerator, BranchAnalyzer branchAnalyzer, RegionSeparator defaultSeparator) {
        this.tokenGenerator = Objects.requireNonNull(tokenGenerator, "tokenGenerator");
        this.branchAnalyzer = Objects.requireNonNull(branchAnalyzer, "branchAnalyzer");
        this.defaultSeparator = Objects.requireNonNull(defaultSeparator, "defaultSeparator");
    }

    void push(StateScope scope) {
        openScopes.push(scope);
    }

    void pop(StateScope scope) {
        if (openScopes.peek() != scope) {
            throw new IllegalStateException("Scope stack out of order");
        }
        openScopes.pop();
    }

    StateScope innermost() {
        return openScopes.peek();
    }

    String nextToken() {
        return tokenGenerator.nextToken();
    }

    BranchAnalyzer branchAnalyzer() {
        return branchAnalyzer;
    }

    RegionSeparator defaultSeparator() {
        return defaultSeparator;
    }
}
