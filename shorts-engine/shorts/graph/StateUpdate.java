package shorts.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import shorts.model.PipelineState;

/**
 * Partial update produced by a stage. Nodes never write the state they are
 * given; the executor applies their updates to its working copy.
 */
public final class StateUpdate {

    private static final StateUpdate NONE = new StateUpdate(Collections.emptyList());

    private final List<Consumer<PipelineState>> changes;

    private StateUpdate(List<Consumer<PipelineState>> changes) {
        this.changes = changes;
    }

    public static StateUpdate none() {
        return NONE;
    }

    public static StateUpdate of(Consumer<PipelineState> change) {
        return none().and(change);
    }

    public StateUpdate and(Consumer<PipelineState> change) {
        List<Consumer<PipelineState>> combined = new ArrayList<>(changes);
        combined.add(change);
        return new StateUpdate(Collections.unmodifiableList(combined));
    }

    public StateUpdate and(StateUpdate other) {
        List<Consumer<PipelineState>> combined = new ArrayList<>(changes);
        combined.addAll(other.changes);
        return new StateUpdate(Collections.unmodifiableList(combined));
    }

    public void applyTo(PipelineState state) {
        for (Consumer<PipelineState> change : changes) {
            change.accept(state);
        }
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }
}
