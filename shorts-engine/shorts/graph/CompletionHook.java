package shorts.graph;

import shorts.model.PipelineState;

/**
 * Called once when a run transitions into {@link Stage#COMPLETED}, before the
 * terminal record is saved.
 */
public interface CompletionHook {

    CompletionHook NONE = state -> StateUpdate.none();

    StateUpdate onCompleted(PipelineState state);
}
