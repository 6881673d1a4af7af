package ai.diagram.composer.registry;

import ai.diagram.composer.error.IdentityCollisionException;
import ai.diagram.composer.error.UnresolvedReferenceException;
import ai.diagram.composer.model.Identities;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Symbol table for one construction scope.
 *
 * <p>Each scope declares its own identities and sees everything declared in its ancestors. When a nested scope
 * closes, {@link #merge(ReferenceRegistry)} makes its identities visible to the parent so that outer transitions can
 * target states declared inside a composite, a region or a parallel branch. Collisions are only checked against
 * identities declared in the same scope. The implicit marker identities can never be declared.
 */
public final class ReferenceRegistry {

    private final ReferenceRegistry parent;
    private final Map<String, String> declared = new LinkedHashMap<>();
    private final Set<String> absorbed = new LinkedHashSet<>();

    private ReferenceRegistry(ReferenceRegistry parent) {
        this.parent = parent;
    }

    public static ReferenceRegistry root() {
        return new ReferenceRegistry(null);
    }

    public ReferenceRegistry child() {
        return new ReferenceRegistry(this);
    }

    public void register(String identity, String displayName) {
        Objects.requireNonNull(identity, "identity");
        if (Identities.isGlobalPseudoIdentity(identity)) {
            throw IdentityCollisionException.reserved(identity, displayName == null ? identity : displayName);
        }
        if (declared.containsKey(identity)) {
            throw new IdentityCollisionException(identity, displayName == null ? identity : displayName);
        }
        declared.put(identity, displayName == null ? identity : displayName);
    }

    /**
     * Returns the identity unchanged when it resolves, fails with the list of known identities otherwise.
     */
    public String validate(String identity, String role) {
        if (isVisible(identity)) {
            return identity;
        }
        throw new UnresolvedReferenceException(identity, role, knownIdentities());
    }

    public boolean isVisible(String identity) {
        if (identity == null) {
            return false;
        }
        if (Identities.isGlobalPseudoIdentity(identity)) {
            return true;
        }
        for (ReferenceRegistry scope = this; scope != null; scope = scope.parent) {
            if (scope.declared.containsKey(identity) || scope.absorbed.contains(identity)) {
                return true;
            }
        }
        return false;
    }

    public void merge(ReferenceRegistry child) {
        Objects.requireNonNull(child, "child");
        if (child.parent != this) {
            throw new IllegalArgumentException("Only a direct child registry can be merged");
        }
        absorbed.addAll(child.declared.keySet());
        absorbed.addAll(child.absorbed);
    }

    public Set<String> declaredIdentities() {
        return Collections.unmodifiableSet(declared.keySet());
    }

    /**
     * Every identity visible from this scope, sorted.
     */
    public List<String> knownIdentities() {
        Set<String> known = new TreeSet<>();
        for (ReferenceRegistry scope = this; scope != null; scope = scope.parent) {
            known.addAll(scope.declared.keySet());
            known.addAll(scope.absorbed);
        }
        return new ArrayList<>(known);
    }
}
