package engine;

import java.util.Optional;

public interface DurableStore {

    Optional<RunRecord> load(String runId);

    /**
     * Inserts or replaces the whole run record. The only path that changes
     * state content; a concurrent {@link #load} sees either the old or the
     * new record, never a mix.
     */
    void save(RunRecord record);

    void recordSuspension(String runId, String stage, String payloadJson);

    void clearSuspension(String runId);

    Optional<SuspensionRecord> pendingSuspension(String runId);

}
