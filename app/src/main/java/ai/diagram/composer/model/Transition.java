package ai.diagram.composer.model;

import java.util.Optional;

/**
 * A directed transition between two identities.
 */
public record Transition(
        String source,
        String target,
        Optional<String> label,
        Optional<String> trigger,
        Optional<String> guard,
        Optional<String> effect,
        Optional<LineStyle> style,
        Optional<Direction> direction,
        Optional<String> note
) implements StateDiagramElement {

    public Transition {
        source = Identities.requireName(source, "transition source");
        target = Identities.requireName(target, "transition target");
        label = nonBlank(label);
        trigger = nonBlank(trigger);
        guard = nonBlank(guard);
        effect = nonBlank(effect);
        style = style == null ? Optional.empty() : style;
        direction = direction == null ? Optional.empty() : direction;
        note = nonBlank(note);
    }

    public static Transition between(String source, String target) {
        return new Transition(source, target, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty());
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value == null ? Optional.empty() : value.filter(text -> !text.isBlank());
    }
}
