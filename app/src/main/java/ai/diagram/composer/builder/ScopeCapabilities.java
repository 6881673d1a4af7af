package ai.diagram.composer.builder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Table of the operations each scope kind accepts.
 */
public final class ScopeCapabilities {

    private static final Map<ScopeKind, Set<ScopeOperation>> TABLE = new EnumMap<>(ScopeKind.class);

    static {
        Set<ScopeOperation> stateContainer = EnumSet.of(
                ScopeOperation.DECLARE_STATE,
                ScopeOperation.DECLARE_PSEUDO_STATE,
                ScopeOperation.DECLARE_TRANSITION,
                ScopeOperation.DECLARE_NOTE,
                ScopeOperation.OPEN_COMPOSITE,
                ScopeOperation.OPEN_CONCURRENT,
                ScopeOperation.OPEN_PARALLEL,
                ScopeOperation.IMPLICIT_MARKER);

        Set<ScopeOperation> diagram = EnumSet.copyOf(stateContainer);
        diagram.add(ScopeOperation.SET_METADATA);
        diagram.add(ScopeOperation.BUILD);

        // branches are entered from the fork bar, so no initial/final markers and no nested fork/join
        Set<ScopeOperation> branch = EnumSet.copyOf(stateContainer);
        branch.remove(ScopeOperation.IMPLICIT_MARKER);
        branch.remove(ScopeOperation.OPEN_PARALLEL);

        TABLE.put(ScopeKind.DIAGRAM, Collections.unmodifiableSet(diagram));
        TABLE.put(ScopeKind.COMPOSITE, Collections.unmodifiableSet(stateContainer));
        TABLE.put(ScopeKind.REGION, Collections.unmodifiableSet(EnumSet.copyOf(stateContainer)));
        TABLE.put(ScopeKind.BRANCH, Collections.unmodifiableSet(branch));
        TABLE.put(ScopeKind.CONCURRENT, Collections.unmodifiableSet(EnumSet.of(ScopeOperation.OPEN_REGION)));
        TABLE.put(ScopeKind.PARALLEL, Collections.unmodifiableSet(EnumSet.of(ScopeOperation.OPEN_BRANCH)));
    }

    private ScopeCapabilities() {
    }

    public static boolean allows(ScopeKind kind, ScopeOperation operation) {
        return TABLE.get(kind).contains(operation);
    }

    public static Set<ScopeOperation> operations(ScopeKind kind) {
        return TABLE.get(kind);
    }

    static String hint(ScopeKind kind, ScopeOperation operation) {
        return switch (operation) {
            case SET_METADATA, BUILD -> "this operation belongs to the diagram handle";
            case OPEN_REGION -> "regions can only be opened on the handle returned by concurrent(...)";
            case OPEN_BRANCH -> "branches can only be opened on the handle returned by parallel(...)";
            default -> switch (kind) {
                case CONCURRENT -> "open a region() inside the concurrent state first";
                case PARALLEL -> "open a branch() inside the parallel block first";
                case BRANCH -> "a branch is entered from its fork bar and cannot hold start/end markers or nested"
                        + " parallel blocks";
                case DIAGRAM, COMPOSITE, REGION -> "this operation is not supported here";
            };
        };
    }
}
