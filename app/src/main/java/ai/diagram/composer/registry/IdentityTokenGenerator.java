package ai.diagram.composer.registry;

/**
 * Supplies identity tokens for constructs the caller did not name, such as anonymous parallel blocks.
 * One generator belongs to one construction session.
 */
@FunctionalInterface
public interface IdentityTokenGenerator {

    String nextToken();
}
