package ai.diagram.composer.error;

import java.util.List;

/**
 * A reference names no identity visible from the current scope.
 */
public class UnresolvedReferenceException extends DiagramDefinitionException {

    private final String identity;
    private final List<String> knownIdentities;

    public UnresolvedReferenceException(String identity, String role, List<String> knownIdentities) {
        super("Unknown " + role + " reference '" + identity + "'. Known identities: "
                + (knownIdentities.isEmpty() ? "(none)" : String.join(", ", knownIdentities)));
        this.identity = identity;
        this.knownIdentities = List.copyOf(knownIdentities);
    }

    public String identity() {
        return identity;
    }

    public List<String> knownIdentities() {
        return knownIdentities;
    }
}
