package ai.diagram.composer.model;

/**
 * Unresolved, caller-supplied reference to an identity.
 */
public record RawIdentity(String value) implements Endpoint {

    public RawIdentity {
        value = Identities.requireName(value, "reference");
    }

    @Override
    public String identity() {
        return value;
    }
}
