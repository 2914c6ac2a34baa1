package arbor.core.result;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Measures the wall-clock time spent on a test or suite.
 *
 * Starting an already started timer has no effect, so a timer always measures from the first start to the last stop.
 * A timer that was never started reports zero.
 */
public final class Timer {
    private long startNanos = -1;
    private long elapsedNanos = 0;

    private Timer() {}

    public static Timer unstarted() {
        return new Timer();
    }

    /**
     * Returns a stopped timer reporting the given duration, as used when results are restored from a snapshot.
     *
     * @param elapsedNanos The duration.
     * @return the timer.
     */
    public static Timer withElapsed(long elapsedNanos) {
        if (elapsedNanos < 0) {
            throw new IllegalArgumentException("elapsedNanos must be non-negative but was: " + elapsedNanos);
        }
        Timer timer = new Timer();
        timer.elapsedNanos = elapsedNanos;
        return timer;
    }

    public void start() {
        if (this.startNanos == -1) {
            this.startNanos = System.nanoTime();
        }
    }

    public long stop() {
        if (this.startNanos != -1) {
            this.elapsedNanos = System.nanoTime() - this.startNanos;
        }
        return this.elapsedNanos;
    }

    public long getElapsedNanos() {
        return this.elapsedNanos;
    }

    /**
     * Returns the elapsed time in seconds, rendered with the given number of decimal places.
     *
     * @param scale The number of decimal places.
     * @return the elapsed seconds.
     */
    public String toSecondsString(int scale) {
        return nanosToSecondsString(this.elapsedNanos, scale);
    }

    public static String nanosToSecondsString(long nanos, int scale) {
        return BigDecimal.valueOf(nanos)
                .divide(BigDecimal.valueOf(1_000_000_000L), scale, RoundingMode.HALF_DOWN)
                .toPlainString();
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { elapsed nanos: " + this.elapsedNanos + " }";
    }
}
