package respite.commands.string;

import respite.commands.Command;
import respite.db.KeyValueStore;
import respite.network.ClientHandler;
import respite.utils.Log;

import java.util.List;
import java.util.Locale;

/**
 * SET key value [PX milliseconds | EX seconds]
 *
 * <p>A TTL that does not parse as an integer is ignored and the value is
 * stored without expiry.
 */
public class SetCommand implements Command {
    private final KeyValueStore store;

    public SetCommand(KeyValueStore store) {
        this.store = store;
    }

    @Override
    public void execute(ClientHandler client, List<String> args) {
        if (args.size() < 3) {
            client.sendArityError(args.get(0));
            return;
        }

        String key = args.get(1);
        String val = args.get(2);
        Long ttlMillis = null;

        for (int i = 3; i < args.size(); i++) {
            String opt = args.get(i).toUpperCase(Locale.ROOT);
            if ((opt.equals("PX") || opt.equals("EX")) && i + 1 < args.size()) {
                String raw = args.get(++i);
                try {
                    long amount = Long.parseLong(raw);
                    ttlMillis = opt.equals("EX") ? Math.multiplyExact(amount, 1000L) : amount;
                } catch (NumberFormatException | ArithmeticException e) {
                    Log.debug("SET " + key + ": ignoring unusable " + opt + " value '" + raw + "'");
                    ttlMillis = null;
                }
            }
        }

        if (ttlMillis != null) {
            store.set(key, val, ttlMillis);
        } else {
            store.set(key, val);
        }
        client.sendSimpleString("OK");
    }
}
