package ai.diagram.composer.builder;

/**
 * Operations gated by {@link ScopeCapabilities}. The method name is used in error messages.
 */
public enum ScopeOperation {
    DECLARE_STATE("state"),
    DECLARE_PSEUDO_STATE("pseudoState"),
    DECLARE_TRANSITION("arrow"),
    DECLARE_NOTE("note"),
    OPEN_COMPOSITE("composite"),
    OPEN_CONCURRENT("concurrent"),
    OPEN_PARALLEL("parallel"),
    OPEN_REGION("region"),
    OPEN_BRANCH("branch"),
    IMPLICIT_MARKER("start"),
    SET_METADATA("title"),
    BUILD("build");

    private final String methodName;

    ScopeOperation(String methodName) {
        this.methodName = methodName;
    }

    public String methodName() {
        return methodName;
    }
}
