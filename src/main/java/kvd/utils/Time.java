package kvd.utils;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Swappable clock so expiry and deadline logic can be driven from tests.
 */
public class Time {
    public interface Clock {
        /** Wall-clock milliseconds, used for key expiry deadlines. */
        long currentTimeMillis();

        /** Monotonic nanoseconds, used for request deadlines. */
        long nanoTime();
    }

    private static final Clock SYSTEM_CLOCK = new Clock() {
        @Override
        public long currentTimeMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }
    };

    private static final AtomicReference<Clock> clock = new AtomicReference<>(SYSTEM_CLOCK);

    public static long now() {
        return clock.get().currentTimeMillis();
    }

    public static long nanoTime() {
        return clock.get().nanoTime();
    }

    public static void setClock(Clock newClock) {
        clock.set(newClock);
    }

    public static void useSystemClock() {
        clock.set(SYSTEM_CLOCK);
    }
}
