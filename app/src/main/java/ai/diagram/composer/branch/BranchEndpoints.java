package ai.diagram.composer.branch;

import java.util.Objects;

/**
 * Where the fork enters a branch and where the branch leaves towards the join.
 */
public record BranchEndpoints(String entry, String exit) {

    public BranchEndpoints {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(exit, "exit");
    }
}
