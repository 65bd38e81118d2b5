package respite.commands.string;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import respite.MockClientHandler;
import respite.db.KeyValueStore;
import respite.utils.Time;

import static org.junit.jupiter.api.Assertions.*;
import static respite.MockClientHandler.args;

public class GetCommandTest {
    private KeyValueStore store;
    private GetCommand cmd;
    private MockClientHandler client;
    private Time.ManualClock clock;

    @BeforeEach
    public void setup() {
        clock = new Time.ManualClock(0L);
        store = new KeyValueStore(clock);
        cmd = new GetCommand(store);
        client = new MockClientHandler();
    }

    @Test
    public void testExistingKey() {
        store.set("foo", "bar");
        cmd.execute(client, args("GET", "foo"));
        assertEquals("$3\r\nbar\r\n", client.lastReply());
    }

    @Test
    public void testMissingKey() {
        cmd.execute(client, args("GET", "missing"));
        assertEquals("$-1\r\n", client.lastReply());
    }

    @Test
    public void testExpiredKeyReadsAsNullButStaysStored() {
        store.set("k", "v", 50);
        clock.advance(60);

        cmd.execute(client, args("GET", "k"));

        assertEquals("$-1\r\n", client.lastReply());
        assertNotNull(store.get("k"));
    }

    @Test
    public void testNoKeySendsNothing() {
        cmd.execute(client, args("GET"));
        assertTrue(client.replies.isEmpty());
    }
}
