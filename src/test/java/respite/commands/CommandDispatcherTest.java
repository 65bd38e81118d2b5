package respite.commands;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import respite.Config;
import respite.MockClientHandler;
import respite.db.KeyValueStore;
import respite.protocol.RespMessage;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class CommandDispatcherTest {
    private KeyValueStore store;
    private CommandDispatcher dispatcher;

    @BeforeEach
    public void setup() {
        store = new KeyValueStore();
        dispatcher = new CommandDispatcher(CommandRegistry.createDefault(store, Config.defaults()));
    }

    private static RespMessage command(String... parts) {
        return RespMessage.bulkArray(Arrays.asList(parts));
    }

    @Test
    public void testDefaultRegistry() {
        assertEquals(Arrays.asList("CONFIG", "ECHO", "GET", "PING", "SET"),
                List.copyOf(dispatcher.getRegistry().names()));
    }

    @Test
    public void testCommandNameIsCaseInsensitive() {
        MockClientHandler client = new MockClientHandler();
        dispatcher.dispatch(client, command("pInG"));
        assertEquals("+PONG\r\n", client.lastReply());
    }

    @Test
    public void testBareStringIsZeroArgumentCommand() {
        MockClientHandler client = new MockClientHandler();
        dispatcher.dispatch(client, RespMessage.simple("PING"));
        dispatcher.dispatch(client, RespMessage.bulk("ping"));
        assertEquals(Arrays.asList("+PONG\r\n", "+PONG\r\n"), client.replies);
    }

    @Test
    public void testSimpleStringArguments() {
        MockClientHandler client = new MockClientHandler();
        dispatcher.dispatch(client, RespMessage.array(Arrays.asList(
                RespMessage.simple("SET"), RespMessage.simple("k"), RespMessage.bulk("v"))));
        assertEquals("+OK\r\n", client.lastReply());
        assertEquals("v", store.get("k").getValue());
    }

    @Test
    public void testSetThenGet() {
        MockClientHandler client = new MockClientHandler();
        dispatcher.dispatch(client, command("SET", "foo", "bar"));
        dispatcher.dispatch(client, command("GET", "foo"));
        assertEquals(Arrays.asList("+OK\r\n", "$3\r\nbar\r\n"), client.replies);
    }

    @Test
    public void testUnknownCommandIsIgnored() {
        MockClientHandler client = new MockClientHandler();
        dispatcher.dispatch(client, command("FLUSHALL"));
        assertTrue(client.replies.isEmpty());
    }

    @Test
    public void testUnknownCommandWithErrorReplies() {
        MockClientHandler client = new MockClientHandler(true);
        dispatcher.dispatch(client, command("FLUSHALL"));
        assertEquals("-ERR unknown command 'FLUSHALL'\r\n", client.lastReply());
    }

    @Test
    public void testEmptyArrayIsIgnored() {
        MockClientHandler client = new MockClientHandler(true);
        dispatcher.dispatch(client, RespMessage.array(Collections.emptyList()));
        assertTrue(client.replies.isEmpty());
    }

    @Test
    public void testToArgsFlattensNestedArrays() {
        RespMessage msg = RespMessage.array(Arrays.asList(
                RespMessage.bulk("ECHO"),
                RespMessage.bulkArray(Arrays.asList("a", "b")),
                RespMessage.nullBulk()));
        assertEquals(Arrays.asList("ECHO", "a b", ""), CommandDispatcher.toArgs(msg));
    }

    @Test
    public void testCustomCommandRegistration() {
        CommandRegistry registry = new CommandRegistry();
        registry.register("hello", (client, args) -> client.sendSimpleString("HI " + args.size()));
        MockClientHandler client = new MockClientHandler();

        new CommandDispatcher(registry).dispatch(client, command("HELLO", "x"));
        assertEquals("+HI 2\r\n", client.lastReply());
    }

    @Test
    public void testCaseFoldingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            CommandDispatcher turkish = new CommandDispatcher(CommandRegistry.createDefault(store,
                    Config.builder().dir("/tmp/redis").build()));
            MockClientHandler client = new MockClientHandler(true);

            turkish.dispatch(client, command("ping"));
            turkish.dispatch(client, command("set", "k", "v", "px", "100000"));
            turkish.dispatch(client, command("get", "k"));
            turkish.dispatch(client, command("config", "get", "dir"));
            turkish.dispatch(client, command("config", "get"));

            assertEquals(Arrays.asList(
                    "+PONG\r\n",
                    "+OK\r\n",
                    "$1\r\nv\r\n",
                    "*2\r\n$3\r\ndir\r\n$10\r\n/tmp/redis\r\n",
                    "-ERR wrong number of arguments for 'config|get' command\r\n"), client.replies);
            assertTrue(store.get("k").hasExpiry());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
