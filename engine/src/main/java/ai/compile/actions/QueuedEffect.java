package ai.compile.actions;

import ai.compile.effects.EffectRun;
import java.util.Objects;

/**
 * A follow-up deferred until the current chain of actions and interrupts is finished: a reaction
 * such as "after you delete cards: draw 1 card", an on-play effect postponed behind an on-cover
 * prompt, or a post-compile shift.
 * <p>
 * A queued effect is dropped when its source card has left the board or turned face-down by the
 * time it is polled.
 */
public final class QueuedEffect {
    private final String sourceCardId;
    private final ActionRequired action;
    private final EffectRun run;

    private QueuedEffect(String sourceCardId, ActionRequired action, EffectRun run) {
        this.sourceCardId = Objects.requireNonNull(sourceCardId, "sourceCardId");
        this.action = action;
        this.run = run;
    }

    public static QueuedEffect ofAction(ActionRequired action) {
        return new QueuedEffect(action.sourceCardId(), action, null);
    }

    public static QueuedEffect ofRun(EffectRun run) {
        return new QueuedEffect(run.sourceCardId(), null, run);
    }

    public String sourceCardId() {
        return sourceCardId;
    }

    public ActionRequired action() {
        return action;
    }

    public EffectRun run() {
        return run;
    }

    @Override
    public String toString() {
        return "Queued[" + (action != null ? action : run) + "]";
    }
}
