package ai.diagram.composer.error;

/**
 * Two declarations in the same scope derived the same identity, or a declaration derived one of the identities
 * reserved for the implicit markers.
 */
public class IdentityCollisionException extends DiagramDefinitionException {

    private final String identity;

    public IdentityCollisionException(String identity, String displayName) {
        this(identity, displayName, false);
    }

    private IdentityCollisionException(String identity, String displayName, boolean reserved) {
        super(reserved
                ? "Identity '" + identity + "' derived from '" + displayName + "' is reserved for the initial, final "
                        + "and history markers; pass an alias to declare it"
                : "Identity '" + identity + "' derived from '" + displayName + "' is already declared in this scope; "
                        + "pass a distinct alias to disambiguate");
        this.identity = identity;
    }

    public static IdentityCollisionException reserved(String identity, String displayName) {
        return new IdentityCollisionException(identity, displayName, true);
    }

    public String identity() {
        return identity;
    }
}
