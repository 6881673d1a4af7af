package ai.diagram.composer.builder;

import ai.diagram.composer.branch.ForkJoinNames;
import ai.diagram.composer.branch.ParallelExpansion;
import ai.diagram.composer.error.IdentityCollisionException;
import ai.diagram.composer.error.StructuralMisuseException;
import ai.diagram.composer.model.CompositeState;
import ai.diagram.composer.model.ConcurrentState;
import ai.diagram.composer.model.Endpoint;
import ai.diagram.composer.model.Identities;
import ai.diagram.composer.model.Note;
import ai.diagram.composer.model.NotePosition;
import ai.diagram.composer.model.PseudoState;
import ai.diagram.composer.model.PseudoStateKind;
import ai.diagram.composer.model.RawIdentity;
import ai.diagram.composer.model.Region;
import ai.diagram.composer.model.RegionSeparator;
import ai.diagram.composer.model.StateDiagramElement;
import ai.diagram.composer.model.StateNode;
import ai.diagram.composer.model.Style;
import ai.diagram.composer.model.Transition;
import ai.diagram.composer.registry.ReferenceRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle for one construction scope: the diagram itself, a composite or concurrent state, a region, a parallel block
 * or one of its branches.
 *
 * <p>All kinds share this class; {@link ScopeCapabilities} decides which operations a kind accepts. A handle only
 * accepts declarations while it is the innermost open scope of its diagram, so every nested block has to be driven
 * through its own handle:
 *
 * <pre>{@code
 * StateDiagramBuilder d = StateDiagramBuilder.create();
 * StateNode idle = d.state("Idle");
 * try (StateScope active = d.composite("Active")) {
 *     StateNode working = active.state("Working");
 *     active.arrow(active.start(), working);
 * }
 * d.arrow(idle, d.ref("Active"), "activate");
 * }</pre>
 *
 * <p>Closing a nested handle freezes what it accumulated into the model, appends the result to the enclosing scope
 * and makes its identities visible there. Closing is idempotent.
 */
public class StateScope implements Endpoint, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StateScope.class);

    private final BuildSession session;
    private final StateScope parent;
    private final ScopeKind kind;
    private final ReferenceRegistry registry;
    private final String name;
    private final StateOptions options;
    private final RegionSeparator separator;
    private final ForkJoinNames forkJoinNames;

    private final List<StateDiagramElement> elements = new ArrayList<>();
    private final List<Region> regions = new ArrayList<>();
    private final List<List<StateDiagramElement>> branches = new ArrayList<>();
    private boolean closed;

    StateScope(BuildSession session) {
        this(session, null, ScopeKind.DIAGRAM, ReferenceRegistry.root(), null, StateOptions.NONE, null, null);
        session.push(this);
    }

    private StateScope(BuildSession session, StateScope parent, ScopeKind kind, ReferenceRegistry registry, String name,
                       StateOptions options, RegionSeparator separator, ForkJoinNames forkJoinNames) {
        this.session = session;
        this.parent = parent;
        this.kind = kind;
        this.registry = registry;
        this.name = name;
        this.options = options;
        this.separator = separator;
        this.forkJoinNames = forkJoinNames;
    }

    public ScopeKind kind() {
        return kind;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Identity of a composite or concurrent state, usable as a transition endpoint inside and after the block.
     */
    @Override
    public String identity() {
        if (!kind.isState()) {
            throw new StructuralMisuseException("A " + kind.label() + " scope is not a state and cannot be a transition"
                    + " endpoint" + (kind == ScopeKind.PARALLEL ? "; use forkNode() or joinNode() instead" : ""));
        }
        return Identities.derive(name, options.alias().orElse(null));
    }

    /**
     * Wraps a caller-typed identity; it is validated when used.
     */
    public Endpoint ref(String identity) {
        return new RawIdentity(identity);
    }

    public StateNode state(String name) {
        return state(name, StateOptions.NONE);
    }

    public StateNode state(String name, StateOptions options) {
        ensureUsable(ScopeOperation.DECLARE_STATE);
        Identities.requireName(name, "state");
        StateOptions attributes = options == null ? StateOptions.NONE : options;
        StateNode node = new StateNode(name, attributes.alias(), attributes.description(), attributes.style(),
                attributes.note());
        registry.register(node.identity(), name);
        elements.add(node);
        return node;
    }

    /**
     * Declares several plain states in order.
     */
    public List<StateNode> states(String... names) {
        ensureUsable(ScopeOperation.DECLARE_STATE);
        List<String> requested = Arrays.asList(names);
        requested.forEach(value -> Identities.requireName(value, "state"));
        List<String> identities = requested.stream().map(Identities::sanitize).collect(Collectors.toList());
        identities.stream().filter(Identities::isGlobalPseudoIdentity).findFirst().ifPresent(reserved -> {
            throw IdentityCollisionException.reserved(reserved, requested.get(identities.indexOf(reserved)));
        });
        List<String> duplicates = identities.stream()
                .filter(identity -> identities.indexOf(identity) != identities.lastIndexOf(identity)
                        || registry.declaredIdentities().contains(identity))
                .distinct()
                .collect(Collectors.toList());
        if (!duplicates.isEmpty()) {
            throw new IdentityCollisionException(duplicates.get(0), requested.get(identities.indexOf(duplicates.get(0))));
        }
        List<StateNode> nodes = new ArrayList<>(names.length);
        for (String value : names) {
            nodes.add(state(value));
        }
        return nodes;
    }

    public PseudoState start() {
        return marker(PseudoState.INITIAL);
    }

    public PseudoState end() {
        return marker(PseudoState.FINAL);
    }

    public PseudoState history() {
        return marker(PseudoState.HISTORY);
    }

    public PseudoState deepHistory() {
        return marker(PseudoState.DEEP_HISTORY);
    }

    public PseudoState choice(String name) {
        return pseudoState(PseudoStateKind.CHOICE, name);
    }

    public PseudoState fork(String name) {
        return pseudoState(PseudoStateKind.FORK, name);
    }

    public PseudoState join(String name) {
        return pseudoState(PseudoStateKind.JOIN, name);
    }

    public PseudoState entryPoint(String name) {
        return pseudoState(PseudoStateKind.ENTRY_POINT, name);
    }

    public PseudoState exitPoint(String name) {
        return pseudoState(PseudoStateKind.EXIT_POINT, name);
    }

    public PseudoState inputPin(String name) {
        return pseudoState(PseudoStateKind.INPUT_PIN, name);
    }

    public PseudoState outputPin(String name) {
        return pseudoState(PseudoStateKind.OUTPUT_PIN, name);
    }

    public PseudoState sdlReceive(String name) {
        return pseudoState(PseudoStateKind.SDL_RECEIVE, name);
    }

    public PseudoState expansionInput(String name) {
        return pseudoState(PseudoStateKind.EXPANSION_INPUT, name);
    }

    public PseudoState expansionOutput(String name) {
        return pseudoState(PseudoStateKind.EXPANSION_OUTPUT, name);
    }

    public PseudoState pseudoState(PseudoStateKind kind, String name) {
        return pseudoState(kind, name, null);
    }

    /**
     * Declares a named pseudo-state. Implicit kinds (initial, final, history, deep history) return their singleton
     * marker and declare nothing.
     */
    public PseudoState pseudoState(PseudoStateKind kind, String name, Style style) {
        Objects.requireNonNull(kind, "kind");
        if (kind.isImplicit()) {
            return marker(switch (kind) {
                case INITIAL -> PseudoState.INITIAL;
                case FINAL -> PseudoState.FINAL;
                case HISTORY -> PseudoState.HISTORY;
                default -> PseudoState.DEEP_HISTORY;
            });
        }
        ensureUsable(ScopeOperation.DECLARE_PSEUDO_STATE);
        Identities.requireName(name, kind.token());
        PseudoState pseudoState = new PseudoState(kind, Optional.of(name), Optional.ofNullable(style));
        registry.register(pseudoState.identity(), name);
        elements.add(pseudoState);
        return pseudoState;
    }

    public Transition arrow(Endpoint source, Endpoint target) {
        return arrow(source, target, TransitionOptions.NONE);
    }

    public Transition arrow(Endpoint source, Endpoint target, String label) {
        return arrow(source, target, TransitionOptions.label(label));
    }

    public Transition arrow(Endpoint source, Endpoint target, TransitionOptions options) {
        return chain(List.of(Objects.requireNonNull(source, "source"), Objects.requireNonNull(target, "target")), options)
                .get(0);
    }

    /**
     * One transition per consecutive pair: {@code chain(a, b, c)} yields a → b and b → c.
     */
    public List<Transition> chain(Endpoint first, Endpoint second, Endpoint... rest) {
        List<Endpoint> endpoints = new ArrayList<>();
        endpoints.add(first);
        endpoints.add(second);
        endpoints.addAll(Arrays.asList(rest));
        return chain(endpoints, TransitionOptions.NONE);
    }

    public List<Transition> chain(List<? extends Endpoint> endpoints, TransitionOptions options) {
        ensureUsable(ScopeOperation.DECLARE_TRANSITION);
        Objects.requireNonNull(endpoints, "endpoints");
        if (endpoints.size() < 2) {
            throw new IllegalArgumentException("A transition chain needs at least two endpoints");
        }
        TransitionOptions attributes = options == null ? TransitionOptions.NONE : options;
        List<String> identities = new ArrayList<>(endpoints.size());
        for (int i = 0; i < endpoints.size(); i++) {
            String role = i == 0 ? "source" : (i == endpoints.size() - 1 ? "target" : "intermediate");
            identities.add(resolve(endpoints.get(i), role));
        }
        List<Transition> transitions = new ArrayList<>(identities.size() - 1);
        for (int i = 0; i < identities.size() - 1; i++) {
            transitions.add(new Transition(identities.get(i), identities.get(i + 1), attributes.label(),
                    attributes.trigger(), attributes.guard(), attributes.effect(), attributes.style(),
                    attributes.direction(), attributes.note()));
        }
        elements.addAll(transitions);
        return transitions;
    }

    public Note note(String content) {
        return note(content, NotePosition.RIGHT);
    }

    public Note note(String content, NotePosition position) {
        ensureUsable(ScopeOperation.DECLARE_NOTE);
        Note note = new Note(content, Objects.requireNonNull(position, "position"), Optional.empty());
        elements.add(note);
        return note;
    }

    /**
     * Adds a note next to an existing state.
     */
    public Note noteOf(Endpoint anchor, String content, NotePosition position) {
        ensureUsable(ScopeOperation.DECLARE_NOTE);
        Objects.requireNonNull(position, "position");
        if (!position.isAnchorable()) {
            throw new IllegalArgumentException("Note position '" + position.keyword()
                    + "' cannot be anchored to a state. Use LEFT, RIGHT, TOP or BOTTOM.");
        }
        String identity = resolve(Objects.requireNonNull(anchor, "anchor"), "note anchor");
        if (Identities.isGlobalPseudoIdentity(identity)) {
            throw new IllegalArgumentException("A note cannot be anchored to the implicit '" + identity + "' marker."
                    + " Anchor it to a declared state, container or named pseudo-state, or use note(...) instead.");
        }
        Note note = new Note(content, position, Optional.of(identity));
        elements.add(note);
        return note;
    }

    public StateScope composite(String name) {
        return composite(name, StateOptions.NONE);
    }

    public StateScope composite(String name, StateOptions options) {
        ensureUsable(ScopeOperation.OPEN_COMPOSITE);
        return openContainer(ScopeKind.COMPOSITE, name, options, null);
    }

    public StateScope concurrent(String name) {
        return concurrent(name, StateOptions.NONE, session.defaultSeparator());
    }

    public StateScope concurrent(String name, StateOptions options) {
        return concurrent(name, options, session.defaultSeparator());
    }

    public StateScope concurrent(String name, StateOptions options, RegionSeparator separator) {
        ensureUsable(ScopeOperation.OPEN_CONCURRENT);
        return openContainer(ScopeKind.CONCURRENT, name, options, Objects.requireNonNull(separator, "separator"));
    }

    public StateScope region() {
        return region(null);
    }

    public StateScope region(String name) {
        ensureUsable(ScopeOperation.OPEN_REGION);
        return openChild(ScopeKind.REGION, name, StateOptions.NONE, null, null);
    }

    /**
     * Opens a parallel block whose fork and join bars are named after a generated token.
     */
    public StateScope parallel() {
        ensureUsable(ScopeOperation.OPEN_PARALLEL);
        return openParallel(ForkJoinNames.generated(session.nextToken()));
    }

    /**
     * Opens a parallel block whose bars are named {@code name_fork} and {@code name_join}.
     */
    public StateScope parallel(String name) {
        ensureUsable(ScopeOperation.OPEN_PARALLEL);
        return openParallel(ForkJoinNames.named(name));
    }

    public StateScope branch() {
        ensureUsable(ScopeOperation.OPEN_BRANCH);
        return openChild(ScopeKind.BRANCH, null, StateOptions.NONE, null, null);
    }

    /**
     * The fork bar synthesized for this parallel block.
     */
    public PseudoState forkNode() {
        return requireParallel("forkNode").fork();
    }

    /**
     * The join bar synthesized for this parallel block.
     */
    public PseudoState joinNode() {
        return requireParallel("joinNode").join();
    }

    /**
     * Freezes the scope into the enclosing one. Subsequent calls do nothing; closing the diagram handle is a no-op.
     */
    @Override
    public void close() {
        if (closed || kind == ScopeKind.DIAGRAM) {
            return;
        }
        StateScope innermost = session.innermost();
        if (innermost != this) {
            throw new StructuralMisuseException("Cannot close " + describe() + " while " + innermost.describe()
                    + " is still open; close the nested scope first");
        }
        closed = true;
        session.pop(this);
        freezeInto(parent);
        parent.registry.merge(registry);
    }

    List<StateDiagramElement> elements() {
        return elements;
    }

    void ensureUsable(ScopeOperation operation) {
        if (closed) {
            throw new StructuralMisuseException("Cannot call " + operation.methodName() + "() on " + describe()
                    + " after it was closed");
        }
        StateScope innermost = session.innermost();
        if (innermost != this) {
            throw new StructuralMisuseException("Cannot call " + operation.methodName() + "() on " + describe()
                    + " while " + innermost.describe() + " is open; call it on the handle returned by "
                    + innermost.openingCall() + " instead, e.g. handle." + operation.methodName() + "(...)");
        }
        if (!ScopeCapabilities.allows(kind, operation)) {
            throw new StructuralMisuseException(operation.methodName() + "() is not available in " + describe() + "; "
                    + ScopeCapabilities.hint(kind, operation));
        }
    }

    String describe() {
        if (kind == ScopeKind.DIAGRAM) {
            return "the diagram scope";
        }
        if (kind == ScopeKind.PARALLEL) {
            return "parallel scope '" + forkJoinNames.prefix() + "'";
        }
        return name == null ? kind.label() + " scope" : kind.label() + " scope '" + name + "'";
    }

    private String openingCall() {
        return switch (kind) {
            case DIAGRAM -> "the diagram builder";
            case COMPOSITE -> "composite(\"" + name + "\")";
            case CONCURRENT -> "concurrent(\"" + name + "\")";
            case REGION -> "region()";
            case PARALLEL -> "parallel(\"" + forkJoinNames.prefix() + "\")";
            case BRANCH -> "branch()";
        };
    }

    private PseudoState marker(PseudoState marker) {
        ensureUsable(ScopeOperation.IMPLICIT_MARKER);
        return marker;
    }

    private String resolve(Endpoint endpoint, String role) {
        Objects.requireNonNull(endpoint, role);
        if (endpoint instanceof RawIdentity raw) {
            return registry.validate(raw.value(), role);
        }
        return endpoint.identity();
    }

    private StateScope openContainer(ScopeKind childKind, String name, StateOptions options, RegionSeparator separator) {
        Identities.requireName(name, childKind.label() + " state");
        StateOptions attributes = options == null ? StateOptions.NONE : options;
        registry.register(Identities.derive(name, attributes.alias().orElse(null)), name);
        return openChild(childKind, name, attributes, separator, null);
    }

    private StateScope openParallel(ForkJoinNames names) {
        return openChild(ScopeKind.PARALLEL, names.prefix(), StateOptions.NONE, null, names);
    }

    private StateScope openChild(ScopeKind childKind, String name, StateOptions options, RegionSeparator separator,
                                 ForkJoinNames names) {
        StateScope child = new StateScope(session, this, childKind, registry.child(), name, options, separator, names);
        session.push(child);
        LOGGER.debug("Opened {} inside {}", child.describe(), describe());
        return child;
    }

    private ForkJoinNames requireParallel(String method) {
        if (kind != ScopeKind.PARALLEL) {
            throw new StructuralMisuseException(method + "() is only available on a parallel scope, not on " + describe());
        }
        return forkJoinNames;
    }

    private void freezeInto(StateScope target) {
        switch (kind) {
            case COMPOSITE -> target.elements.add(new CompositeState(name, options.alias(), elements, options.style(),
                    options.note()));
            case CONCURRENT -> target.elements.add(new ConcurrentState(name, options.alias(), regions, options.style(),
                    options.note(), separator));
            case REGION -> target.regions.add(new Region(Optional.ofNullable(name), elements));
            case BRANCH -> target.branches.add(List.copyOf(elements));
            case PARALLEL -> {
                ParallelExpansion expansion = session.branchAnalyzer().expand(forkJoinNames, branches);
                String forkIdentity = expansion.fork().identity();
                String joinIdentity = expansion.join().identity();
                if (target.registry.declaredIdentities().contains(forkIdentity)) {
                    throw new IdentityCollisionException(forkIdentity, forkIdentity);
                }
                if (target.registry.declaredIdentities().contains(joinIdentity)) {
                    throw new IdentityCollisionException(joinIdentity, joinIdentity);
                }
                target.registry.register(forkIdentity, forkIdentity);
                target.registry.register(joinIdentity, joinIdentity);
                target.elements.addAll(expansion.elements());
            }
            case DIAGRAM -> throw new IllegalStateException("The diagram scope has no enclosing scope");
        }
        LOGGER.debug("Closed {} with {} elements, {} regions, {} branches", describe(), elements.size(), regions.size(),
                branches.size());
    }
}
