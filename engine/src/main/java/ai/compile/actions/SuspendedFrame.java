package ai.compile.actions;

import ai.compile.effects.EffectRun;
import java.util.Objects;

/**
 * An interrupt stack entry: either an action that was active when a newer one was issued, or an
 * effect that was mid-execution when one of its steps triggered something needing input.
 */
public final class SuspendedFrame {
    private final ActionRequired action;
    private final EffectRun continuation;

    private SuspendedFrame(ActionRequired action, EffectRun continuation) {
        this.action = action;
        this.continuation = continuation;
    }

    public static SuspendedFrame ofAction(ActionRequired action) {
        return new SuspendedFrame(Objects.requireNonNull(action, "action"), null);
    }

    public static SuspendedFrame ofContinuation(EffectRun continuation) {
        return new SuspendedFrame(null, Objects.requireNonNull(continuation, "continuation"));
    }

    public boolean isAction() {
        return action != null;
    }

    public ActionRequired action() {
        return action;
    }

    public EffectRun continuation() {
        return continuation;
    }

    @Override
    public String toString() {
        return isAction() ? "Suspended[" + action + "]" : "Suspended[" + continuation + "]";
    }
}
