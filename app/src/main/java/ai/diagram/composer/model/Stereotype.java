package ai.diagram.composer.model;

import java.util.Optional;

public record Stereotype(String name, Optional<Spot> spot) {

    public Stereotype {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stereotype name must not be blank");
        }
        spot = spot == null ? Optional.empty() : spot;
    }

    public static Stereotype of(String name) {
        return new Stereotype(name, Optional.empty());
    }

    public static Stereotype of(String name, Spot spot) {
        return new Stereotype(name, Optional.of(spot));
    }
}
