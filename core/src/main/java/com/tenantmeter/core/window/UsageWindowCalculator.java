package com.tenantmeter.core.window;

import com.tenantmeter.core.model.UsageWindow;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Determines which UTC days must be (re)computed for a given instant.
 * <p>
 * Today is always computed. Until the finalization cutoff hour (inclusive) yesterday is computed as well,
 * because the metrics store keeps aggregating samples for the previous day for a while after midnight.
 * </p>
 */
public class UsageWindowCalculator {
    public static final int DEFAULT_CUTOFF_HOUR = 5;
    public static final String DURATION_LABEL = "1d";

    private static final Duration DAY = Duration.ofDays(1);

    private final int cutoffHour;

    public UsageWindowCalculator() {
        this(DEFAULT_CUTOFF_HOUR);
    }

    /**
     * @param cutoffHour last UTC hour of the day (0-23) at which yesterday is still recomputed
     */
    public UsageWindowCalculator(int cutoffHour) {
        if (cutoffHour < 0 || cutoffHour > 23) {
            throw new IllegalArgumentException("cutoffHour must be within [0, 23], got " + cutoffHour);
        }
        this.cutoffHour = cutoffHour;
    }

    /**
     * Windows to compute at {@code now}, oldest first.
     */
    public List<UsageWindow> windowsAt(Instant now) {
        ZonedDateTime utcNow = now.atZone(ZoneOffset.UTC);
        Instant today = utcNow.truncatedTo(ChronoUnit.DAYS).toInstant();

        List<UsageWindow> windows = new ArrayList<>(2);
        if (utcNow.getHour() <= cutoffHour) {
            windows.add(windowOf(today.minus(DAY), now));
        }
        windows.add(windowOf(today, now));
        return windows;
    }

    /**
     * Window of the day starting at {@code dayStart}, as seen at {@code now}.
     */
    public UsageWindow windowOf(Instant dayStart, Instant now) {
        Instant end = dayStart.plus(DAY);
        Instant effectiveNow = now.isBefore(end) ? now : end;
        long rangeSeconds = Math.max(0, Duration.between(dayStart, effectiveNow).getSeconds());

        return UsageWindow.builder()
                .start(dayStart)
                .end(end)
                .durationLabel(DURATION_LABEL)
                .rangeSeconds(rangeSeconds)
                .build();
    }
}
