package respite.commands;

import respite.network.ClientHandler;

import java.util.List;

public interface Command {
    // args.get(0) is the command name as the client sent it.
    // The command replies through the client's send methods, or not at all.
    void execute(ClientHandler client, List<String> args);
}
