package org.janelia.surfalign.util;

/**
 * Utility to track elapsed process time and throttle progress logging.
 */
public class ProcessTimer {

    public static final long DEFAULT_LOG_INTERVAL = 5000;

    private final long logInterval;
    private final long start;
    private long lastLogTime;

    public ProcessTimer() {
        this(DEFAULT_LOG_INTERVAL);
    }

    /**
     * @param  logInterval  minimum number of milliseconds between progress log events.
     */
    public ProcessTimer(final long logInterval) {
        this.logInterval = logInterval;
        this.start = System.currentTimeMillis();
        this.lastLogTime = this.start;
    }

    /**
     * @return true (and restarts the interval) if at least one log interval has passed since the last call
     *         that returned true.
     */
    public boolean hasIntervalPassed() {
        final long now = System.currentTimeMillis();
        final boolean hasPassed = (now - lastLogTime) > logInterval;
        if (hasPassed) {
            lastLogTime = now;
        }
        return hasPassed;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long elapsed = getElapsedMilliseconds();
        final long totalSeconds = elapsed / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        final long milliseconds = elapsed % 1000;
        return minutes + " minutes, " + seconds + "." + String.format("%03d", milliseconds) + " seconds";
    }
}
