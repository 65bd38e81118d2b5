package respite.utils;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Millisecond clocks behind expiry decisions. Whatever judges expiry owns its
 * {@link Clock}; tests hand in a {@link ManualClock} instead of sleeping.
 */
public class Time {
    public interface Clock {
        long currentTimeMillis();
    }

    public static final Clock SYSTEM = System::currentTimeMillis;

    /** Clock that only moves when told to. */
    public static class ManualClock implements Clock {
        private final AtomicLong millis;

        public ManualClock(long startMillis) {
            this.millis = new AtomicLong(startMillis);
        }

        @Override
        public long currentTimeMillis() {
            return millis.get();
        }

        public void advance(long deltaMillis) {
            millis.addAndGet(deltaMillis);
        }

        public void set(long newMillis) {
            millis.set(newMillis);
        }
    }

    private Time() { }
}
