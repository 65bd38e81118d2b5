package respite.commands;

import respite.network.ClientHandler;
import respite.protocol.RespMessage;
import respite.utils.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns a decoded message into a command name plus arguments and runs the
 * matching {@link Command}.
 */
public class CommandDispatcher {
    private final CommandRegistry registry;

    public CommandDispatcher(CommandRegistry registry) {
        this.registry = registry;
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public void dispatch(ClientHandler client, RespMessage msg) {
        List<String> args = toArgs(msg);
        if (args.isEmpty()) return;

        String name = args.get(0);
        Command cmd = registry.get(name);
        if (cmd == null) {
            client.sendUnknownCommand(name);
            return;
        }
        if (Log.isDebugEnabled()) {
            Log.debug(client.getRemoteAddress() + " " + name.toUpperCase(Locale.ROOT) + " (" + (args.size() - 1) + " args)");
        }
        cmd.execute(client, args);
    }

    /**
     * An array becomes name + arguments; a bare string is a command with no
     * arguments; an empty array yields an empty list.
     */
    public static List<String> toArgs(RespMessage msg) {
        if (msg instanceof RespMessage.Array) {
            List<RespMessage> elements = ((RespMessage.Array) msg).getElements();
            List<String> args = new ArrayList<>(elements.size());
            for (RespMessage element : elements) {
                args.add(element.text());
            }
            return args;
        }
        return Collections.singletonList(msg.text());
    }
}
