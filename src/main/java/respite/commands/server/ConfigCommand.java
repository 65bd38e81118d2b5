package respite.commands.server;

import respite.Config;
import respite.commands.Command;
import respite.network.ClientHandler;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * CONFIG GET parameter: replies {@code [parameter, value]}, with {@code "nil"}
 * for unknown or unset parameters.
 */
public class ConfigCommand implements Command {
    static final String MISSING = "nil";

    private final Config config;

    public ConfigCommand(Config config) {
        this.config = config;
    }

    @Override
    public void execute(ClientHandler client, List<String> args) {
        if (args.size() < 2) {
            client.sendArityError(args.get(0));
            return;
        }

        String sub = args.get(1).toUpperCase(Locale.ROOT);
        switch (sub) {
            case "GET":
                handleGet(client, args);
                break;
            default:
                client.sendUnknownCommand(args.get(0) + " " + args.get(1));
        }
    }

    private void handleGet(ClientHandler client, List<String> args) {
        if (args.size() < 3) {
            client.sendArityError(args.get(0) + "|" + args.get(1));
            return;
        }

        String param = args.get(2);
        String value = config.get(param);
        client.sendArray(Arrays.asList(param, value != null ? value : MISSING));
    }
}
