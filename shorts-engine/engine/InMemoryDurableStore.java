package engine;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Everything is lost when the JVM exits.
 */
public class InMemoryDurableStore implements DurableStore {

    private final Map<String, RunRecord> runs = new ConcurrentHashMap<>();
    private final Map<String, SuspensionRecord> suspensions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDurableStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDurableStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<RunRecord> load(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public void save(RunRecord record) {
        runs.put(record.getRunId(), record);
    }

    @Override
    public void recordSuspension(String runId, String stage, String payloadJson) {
        if (!runs.containsKey(runId)) {
            throw new IllegalStateException("Cannot suspend unknown run: " + runId);
        }
        suspensions.put(runId, new SuspensionRecord(runId, stage, payloadJson, clock.instant()));
    }

    @Override
    public void clearSuspension(String runId) {
        suspensions.remove(runId);
    }

    @Override
    public Optional<SuspensionRecord> pendingSuspension(String runId) {
        return Optional.ofNullable(suspensions.get(runId));
    }
}
