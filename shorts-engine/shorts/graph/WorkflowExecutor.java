package shorts.graph;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import engine.DurableStore;
import engine.RunRecord;
import engine.SuspensionRecord;
import shorts.gate.GateDecision;
import shorts.gate.GateType;
import shorts.gate.HumanGate;
import shorts.gate.ResumeRejectedException;
import shorts.model.EditorOutput;
import shorts.model.PipelineState;

/**
 * Drives runs through the stage graph, checkpointing after every transition.
 *
 * <p>A dispatch cycle loads the run, invokes the node for its current stage,
 * merges the node's update, asks the router for the next stage and saves, until
 * the run suspends on a gate or reaches a terminal stage. The durable store is
 * the only source of truth: any process can pick up a run where the last one
 * left it, and a node interrupted by a crash simply runs again.
 *
 * <p>One cycle per run at a time; distinct runs may be driven concurrently
 * from different threads.
 */
public class WorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    private final DurableStore store;
    private final StateCodec codec;
    private final QualityGatedRouter router;
    private final Map<Stage, StageNode> nodes = new EnumMap<>(Stage.class);
    private final Map<GateType, HumanGate> gates = new EnumMap<>(GateType.class);
    private final CompletionHook completionHook;
    private final Clock clock;

    // Runs with a cycle in flight in this process
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public WorkflowExecutor(DurableStore store,
                            QualityGatedRouter router,
                            Collection<? extends StageNode> stageNodes,
                            CompletionHook completionHook) {
        this(store, new StateCodec(), router, stageNodes, completionHook, Clock.systemUTC());
    }

    public WorkflowExecutor(DurableStore store,
                            StateCodec codec,
                            QualityGatedRouter router,
                            Collection<? extends StageNode> stageNodes,
                            CompletionHook completionHook,
                            Clock clock) {
        this.store = store;
        this.codec = codec;
        this.router = router;
        this.completionHook = completionHook == null ? CompletionHook.NONE : completionHook;
        this.clock = clock;

        for (StageNode node : stageNodes) {
            if (nodes.put(node.stage(), node) != null) {
                throw new IllegalArgumentException("Two nodes registered for stage " + node.stage().key());
            }
            if (node instanceof HumanGate) {
                HumanGate gate = (HumanGate) node;
                gates.put(gate.type(), gate);
            } else if (node.stage().isGate()) {
                throw new IllegalArgumentException("Gate stage " + node.stage().key() + " needs a HumanGate node");
            }
        }
        for (Stage stage : Stage.values()) {
            if (!stage.isTerminal() && !nodes.containsKey(stage)) {
                throw new IllegalArgumentException("No node registered for stage " + stage.key());
            }
        }
    }

    // ---------------- OPERATIONS ----------------

    /**
     * Creates the run and drives it until its first suspension or a terminal stage.
     *
     * @throws IllegalArgumentException if a run with this id already exists
     */
    public RunStatusView start(String runId, String ownerId, Map<String, Object> userPreferences) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId is required");
        }
        acquire(runId);
        try {
            if (store.load(runId).isPresent()) {
                throw new IllegalArgumentException("Run already exists: " + runId);
            }
            PipelineState state = PipelineState.initial(runId, ownerId, userPreferences);
            Instant now = clock.instant();
            RunRecord record = new RunRecord(runId, ownerId, now, now, Stage.RESEARCH.key(), codec.write(state));
            store.save(record);
            log.info("Run {} started for owner {}", runId, ownerId);

            return dispatch(record, state);
        } finally {
            release(runId);
        }
    }

    /**
     * Re-enters the dispatch cycle from the persisted stage. Used to recover runs
     * after a restart; does nothing for suspended or finished runs.
     */
    public RunStatusView advance(String runId) {
        acquire(runId);
        try {
            RunRecord record = loadExisting(runId);
            Stage stage = Stage.fromKey(record.getStage());
            Optional<SuspensionRecord> suspension = store.pendingSuspension(runId);
            if (suspension.isPresent() && !suspension.get().getStage().equals(stage.key())) {
                // The resume was applied but the process died before clearing the row
                log.warn("Run {} has a stale suspension at {} while at {}; clearing it",
                        runId, suspension.get().getStage(), stage.key());
                store.clearSuspension(runId);
            }
            return dispatch(record, codec.read(record.getStateJson()));
        } finally {
            release(runId);
        }
    }

    /**
     * Applies a human decision to a run suspended on {@code gateType} and keeps
     * driving it from the gate's successor.
     *
     * @throws ResumeRejectedException if the run is not waiting on that gate or the
     *                                 payload is invalid; nothing is changed
     */
    public RunStatusView resume(String runId, GateType gateType, Map<String, Object> payload) {
        acquire(runId);
        try {
            RunRecord record = loadExisting(runId);
            SuspensionRecord suspension = store.pendingSuspension(runId)
                    .orElseThrow(() -> new ResumeRejectedException(runId, "run is not waiting for input"));

            Stage gateStage = gateType.stage();
            if (!suspension.getStage().equals(gateStage.key())) {
                throw new ResumeRejectedException(runId,
                        "run is waiting on " + suspension.getStage() + ", not " + gateStage.key());
            }
            if (!record.getStage().equals(gateStage.key())) {
                log.warn("Run {} already moved past {}; clearing stale suspension", runId, gateStage.key());
                store.clearSuspension(runId);
                throw new ResumeRejectedException(runId, "decision for " + gateType.tag() + " was already applied");
            }

            PipelineState state = codec.read(record.getStateJson());
            GateDecision decision = gates.get(gateType).decide(codec.copy(state), payload == null ? Map.of() : payload);
            decision.getUpdate().applyTo(state);

            Stage next = router.route(gateStage, state);
            record = persist(record, next, state);
            store.clearSuspension(runId);
            log.info("Run {} resumed at {} ({}), next stage {}", runId, gateStage.key(), decision.getSummary(), next.key());

            return dispatch(record, state);
        } finally {
            release(runId);
        }
    }

    public RunStatusView status(String runId) {
        RunRecord record = loadExisting(runId);
        PipelineState state = codec.read(record.getStateJson());
        Stage stage = Stage.fromKey(record.getStage());

        RunStatus status;
        GateType waitingOn = null;
        Map<String, Object> payload = null;

        if (stage == Stage.COMPLETED) {
            status = RunStatus.COMPLETED;
        } else if (stage == Stage.FAILED) {
            status = RunStatus.FAILED;
        } else {
            Optional<SuspensionRecord> suspension = store.pendingSuspension(runId)
                    .filter(s -> s.getStage().equals(stage.key()));
            if (suspension.isPresent()) {
                status = RunStatus.WAITING;
                waitingOn = GateType.forStage(stage);
                payload = codec.readPayload(suspension.get().getPayloadJson());
            } else {
                status = RunStatus.RUNNING;
            }
        }

        return new RunStatusView(
                record.getRunId(),
                record.getOwnerId(),
                status,
                stage,
                waitingOn,
                payload,
                state.getRetryCounts(),
                state.getQuality(),
                state.getError(),
                record.getUpdatedAt()
        );
    }

    /**
     * The final artifact of a completed run; empty while the run is unfinished or failed.
     */
    public Optional<EditorOutput> result(String runId) {
        RunRecord record = loadExisting(runId);
        if (!Stage.COMPLETED.key().equals(record.getStage())) {
            return Optional.empty();
        }
        return Optional.ofNullable(codec.read(record.getStateJson()).getEditorOutput());
    }

    // ---------------- DISPATCH CYCLE ----------------

    private RunStatusView dispatch(RunRecord record, PipelineState state) {
        String runId = record.getRunId();
        Stage stage = Stage.fromKey(record.getStage());

        if (store.pendingSuspension(runId).isPresent()) {
            log.debug("Run {} is suspended at {}; nothing to do", runId, stage.key());
            return status(runId);
        }

        while (!stage.isTerminal()) {
            StageNode node = nodes.get(stage);
            log.debug("Run {} entering {}", runId, stage.key());

            NodeResult result = node.run(codec.copy(state));

            if (result.isSuspended()) {
                // State first: a crash before the suspension row just re-runs the gate
                record = persist(record, stage, state);
                store.recordSuspension(runId, stage.key(), codec.writePayload(result.getSuspensionPayload()));
                log.info("Run {} suspended at {}", runId, stage.key());
                break;
            }

            result.getUpdate().applyTo(state);

            Stage next = router.route(stage, state);
            if (router.isExhausted(stage, state)) {
                router.recordExhaustion(stage, state);
                log.warn("Run {} exhausted retries at {} -> {}", runId, stage.key(), next.key());
            } else if (next == stage) {
                log.info("Run {} retrying {} (attempt {} failed: {})",
                        runId, stage.key(), state.attemptsOf(stage.key()), state.getQuality());
            }

            if (next == Stage.COMPLETED) {
                completionHook.onCompleted(codec.copy(state)).applyTo(state);
                log.info("Run {} completed", runId);
            } else if (next == Stage.FAILED) {
                log.error("Run {} failed: {}", runId, state.getError());
            }

            record = persist(record, next, state);
            stage = next;
        }
        return status(runId);
    }

    private RunRecord persist(RunRecord record, Stage stage, PipelineState state) {
        RunRecord updated = record.withState(stage.key(), codec.write(state), clock.instant());
        store.save(updated);
        return updated;
    }

    private RunRecord loadExisting(String runId) {
        return store.load(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
    }

    private void acquire(String runId) {
        if (!inFlight.add(runId)) {
            throw new RunBusyException(runId);
        }
    }

    private void release(String runId) {
        inFlight.remove(runId);
    }
}
