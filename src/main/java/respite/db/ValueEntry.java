package respite.db;

/**
 * A stored string and its absolute expiry time in epoch millis,
 * {@code -1} when the key has no TTL.
 */
public class ValueEntry {
    public static final long NO_EXPIRY = -1;

    private final String value;
    private final long expireAt;

    public ValueEntry(String value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public String getValue() {
        return value;
    }

    public long getExpireAt() {
        return expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRY;
    }

    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRY && expireAt <= now;
    }

    @Override
    public String toString() {
        return "ValueEntry{value=" + value + ", expireAt=" + expireAt + "}";
    }
}
