package respite.commands.connection;

import respite.commands.Command;
import respite.network.ClientHandler;

import java.util.List;

public class PingCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<String> args) {
        if (args.size() > 1) {
            client.sendBulkString(args.get(1));
        } else {
            client.sendSimpleString("PONG");
        }
    }
}
