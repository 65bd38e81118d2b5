package respite.commands;

import respite.Config;
import respite.commands.connection.EchoCommand;
import respite.commands.connection.PingCommand;
import respite.commands.server.ConfigCommand;
import respite.commands.string.GetCommand;
import respite.commands.string.SetCommand;
import respite.db.KeyValueStore;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps upper-case command names to their implementations.
 */
public class CommandRegistry {
    private final Map<String, Command> commands = new ConcurrentHashMap<>();

    public static CommandRegistry createDefault(KeyValueStore store, Config config) {
        CommandRegistry registry = new CommandRegistry();

        // Connection
        registry.register("PING", new PingCommand());
        registry.register("ECHO", new EchoCommand());

        // String
        registry.register("SET", new SetCommand(store));
        registry.register("GET", new GetCommand(store));

        // Server
        registry.register("CONFIG", new ConfigCommand(config));

        return registry;
    }

    public void register(String name, Command command) {
        commands.put(name.toUpperCase(Locale.ROOT), command);
    }

    public Command get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(commands.keySet()));
    }
}
