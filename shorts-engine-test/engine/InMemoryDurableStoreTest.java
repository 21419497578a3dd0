package engine;

import java.time.Clock;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;

@DisplayName("InMemoryDurableStore Tests")
class InMemoryDurableStoreTest extends DurableStoreContractTest {

    @Override
    protected DurableStore createStore() {
        return new InMemoryDurableStore(Clock.fixed(T1, ZoneOffset.UTC));
    }
}
