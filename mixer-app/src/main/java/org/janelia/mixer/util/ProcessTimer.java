package org.janelia.mixer.util;

/**
 * Utility to track elapsed processing time.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long totalMilliseconds = getElapsedMilliseconds();
        if (totalMilliseconds < 1000) {
            return totalMilliseconds + " milliseconds";
        }
        final long totalSeconds = totalMilliseconds / 1000;
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
