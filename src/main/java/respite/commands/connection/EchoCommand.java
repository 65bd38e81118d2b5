package respite.commands.connection;

import respite.commands.Command;
import respite.network.ClientHandler;

import java.util.List;

/**
 * ECHO message [message ...]: replies with the arguments joined by single spaces.
 */
public class EchoCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<String> args) {
        if (args.size() < 2) {
            client.sendArityError(args.get(0));
            return;
        }
        client.sendBulkString(String.join(" ", args.subList(1, args.size())));
    }
}
