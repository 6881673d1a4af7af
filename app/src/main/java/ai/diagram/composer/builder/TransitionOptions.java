package ai.diagram.composer.builder;

import ai.diagram.composer.model.Direction;
import ai.diagram.composer.model.LineStyle;
import java.util.Optional;

/**
 * Optional attributes of a transition. When used with a chain every generated transition receives them.
 */
public record TransitionOptions(
        Optional<String> label,
        Optional<String> trigger,
        Optional<String> guard,
        Optional<String> effect,
        Optional<LineStyle> style,
        Optional<Direction> direction,
        Optional<String> note
) {

    public static final TransitionOptions NONE = new TransitionOptions(Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public TransitionOptions {
        label = label == null ? Optional.empty() : label;
        trigger = trigger == null ? Optional.empty() : trigger;
        guard = guard == null ? Optional.empty() : guard;
        effect = effect == null ? Optional.empty() : effect;
        style = style == null ? Optional.empty() : style;
        direction = direction == null ? Optional.empty() : direction;
        note = note == null ? Optional.empty() : note;
    }

    public static TransitionOptions label(String label) {
        return NONE.withLabel(label);
    }

    public static TransitionOptions guard(String guard) {
        return NONE.withGuard(guard);
    }

    public TransitionOptions withLabel(String value) {
        return new TransitionOptions(Optional.ofNullable(value), trigger, guard, effect, style, direction, note);
    }

    public TransitionOptions withTrigger(String value) {
        return new TransitionOptions(label, Optional.ofNullable(value), guard, effect, style, direction, note);
    }

    public TransitionOptions withGuard(String value) {
        return new TransitionOptions(label, trigger, Optional.ofNullable(value), effect, style, direction, note);
    }

    public TransitionOptions withEffect(String value) {
        return new TransitionOptions(label, trigger, guard, Optional.ofNullable(value), style, direction, note);
    }

    public TransitionOptions withStyle(LineStyle value) {
        return new TransitionOptions(label, trigger, guard, effect, Optional.ofNullable(value), direction, note);
    }

    public TransitionOptions withDirection(Direction value) {
        return new TransitionOptions(label, trigger, guard, effect, style, Optional.ofNullable(value), note);
    }

    public TransitionOptions withNote(String value) {
        return new TransitionOptions(label, trigger, guard, effect, style, direction, Optional.ofNullable(value));
    }
}
