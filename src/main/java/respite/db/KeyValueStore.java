package respite.db;

import respite.utils.Time;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The shared string keyspace.
 *
 * <p>Expiry is judged lazily: an entry past its {@code expireAt} stays in the
 * map until the key is written again. Nothing sweeps it. Each operation is a
 * single {@link ConcurrentHashMap} call, so reads and writes from different
 * event-loop threads never observe a half-applied update. Expiry is judged
 * against the store's own clock.
 */
public class KeyValueStore {
    private final ConcurrentHashMap<String, ValueEntry> store = new ConcurrentHashMap<>();
    private final Time.Clock clock;

    public KeyValueStore() {
        this(Time.SYSTEM);
    }

    public KeyValueStore(Time.Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Overwrites {@code key} with a value that never expires. */
    public void set(String key, String value) {
        store.put(key, new ValueEntry(Objects.requireNonNull(value, "value"), ValueEntry.NO_EXPIRY));
    }

    /**
     * Overwrites {@code key} with a value that expires {@code ttlMillis} from now.
     * A zero or negative TTL yields an entry that is already expired.
     */
    public void set(String key, String value, long ttlMillis) {
        long now = clock.currentTimeMillis();
        long expireAt;
        if (ttlMillis > Long.MAX_VALUE - now) {
            expireAt = Long.MAX_VALUE;
        } else {
            // Keep clear of NO_EXPIRY for hugely negative TTLs
            expireAt = Math.max(0, now + ttlMillis);
        }
        store.put(key, new ValueEntry(Objects.requireNonNull(value, "value"), expireAt));
    }

    /** Raw lookup; may return an entry that has already expired. */
    public ValueEntry get(String key) {
        return store.get(key);
    }

    /** The entry for {@code key} if present and not expired. Never removes anything. */
    public ValueEntry getLive(String key) {
        ValueEntry entry = store.get(key);
        if (entry == null || entry.isExpired(clock.currentTimeMillis())) {
            return null;
        }
        return entry;
    }

    public int size() {
        return store.size();
    }
}
