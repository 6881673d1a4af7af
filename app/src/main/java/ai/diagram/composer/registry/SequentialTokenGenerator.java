package ai.diagram.composer.registry;

/**
 * Produces {@code prefix_1}, {@code prefix_2}, ... in call order.
 */
public class SequentialTokenGenerator implements IdentityTokenGenerator {

    public static final String DEFAULT_PREFIX = "parallel";

    private final String prefix;
    private int counter;

    public SequentialTokenGenerator() {
        this(DEFAULT_PREFIX);
    }

    public SequentialTokenGenerator(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        this.prefix = prefix;
    }

    @Override
    public String nextToken() {
        counter++;
        return prefix + "_" + counter;
    }
}
