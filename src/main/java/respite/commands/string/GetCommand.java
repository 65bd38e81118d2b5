package respite.commands.string;

import respite.commands.Command;
import respite.db.KeyValueStore;
import respite.db.ValueEntry;
import respite.network.ClientHandler;

import java.util.List;

public class GetCommand implements Command {
    private final KeyValueStore store;

    public GetCommand(KeyValueStore store) {
        this.store = store;
    }

    @Override
    public void execute(ClientHandler client, List<String> args) {
        if (args.size() < 2) {
            client.sendArityError(args.get(0));
            return;
        }

        // Expired entries read as missing but stay in the store.
        ValueEntry entry = store.getLive(args.get(1));
        if (entry == null) {
            client.sendNull();
        } else {
            client.sendBulkString(entry.getValue());
        }
    }
}
