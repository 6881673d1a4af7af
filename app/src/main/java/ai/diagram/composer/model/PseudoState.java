package ai.diagram.composer.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A pseudo-state such as a choice diamond, a fork bar or the implicit initial marker.
 */
public record PseudoState(PseudoStateKind kind, Optional<String> name, Optional<Style> style)
        implements StateDiagramElement, Endpoint {

    public static final PseudoState INITIAL = implicit(PseudoStateKind.INITIAL);
    public static final PseudoState FINAL = implicit(PseudoStateKind.FINAL);
    public static final PseudoState HISTORY = implicit(PseudoStateKind.HISTORY);
    public static final PseudoState DEEP_HISTORY = implicit(PseudoStateKind.DEEP_HISTORY);

    public PseudoState {
        Objects.requireNonNull(kind, "kind");
        name = name == null ? Optional.empty() : name;
        style = style == null ? Optional.empty() : style;
        if (!kind.isImplicit()) {
            Identities.requireName(name.orElse(null), kind.token());
        }
    }

    public static PseudoState named(PseudoStateKind kind, String name) {
        return new PseudoState(kind, Optional.ofNullable(name), Optional.empty());
    }

    @Override
    public String identity() {
        if (kind.isImplicit()) {
            return kind.token();
        }
        return Identities.sanitize(name.orElseThrow());
    }

    private static PseudoState implicit(PseudoStateKind kind) {
        return new PseudoState(kind, Optional.empty(), Optional.empty());
    }
}
