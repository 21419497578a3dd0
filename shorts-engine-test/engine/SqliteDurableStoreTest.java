package engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SqliteDurableStore Tests")
class SqliteDurableStoreTest extends DurableStoreContractTest {

    @TempDir
    Path dir;

    private String url() {
        return "jdbc:sqlite:" + dir.resolve("checkpoints.db");
    }

    @Override
    protected DurableStore createStore() {
        return new SqliteDurableStore(url(), Clock.fixed(T1, ZoneOffset.UTC));
    }

    @AfterEach
    void closeStore() {
        ((SqliteDurableStore) store).close();
    }

    @Test
    @DisplayName("Runs and suspensions survive reopening the database")
    void survivesReopen() {
        RunRecord record = new RunRecord("run-1", "owner-1", T0, T1, "review_gate", "{\"draft\":1}");
        store.save(record);
        store.recordSuspension("run-1", "review_gate", "{\"type\":\"script_review\"}");
        ((SqliteDurableStore) store).close();

        store = new SqliteDurableStore(url());

        assertThat(store.load("run-1")).contains(record);
        assertThat(store.pendingSuspension("run-1")).get()
                .satisfies(s -> {
                    assertThat(s.getStage()).isEqualTo("review_gate");
                    assertThat(s.getSuspendedAt()).isEqualTo(T1);
                });
    }

    @Test
    @DisplayName("Unreachable database is reported as a store failure")
    void badUrlFails() {
        assertThatThrownBy(() -> new SqliteDurableStore("jdbc:sqlite:" + dir.resolve("no/such/dir/x.db")))
                .isInstanceOf(CheckpointStoreException.class);
    }
}
