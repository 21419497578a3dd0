package shorts.graph;

import shorts.model.PipelineState;

/**
 * One vertex of the workflow graph. A node may run more than once for the same
 * run (retries, crash recovery), so it must not rely on having run before.
 */
public interface StageNode {

    Stage stage();

    NodeResult run(PipelineState state);
}
