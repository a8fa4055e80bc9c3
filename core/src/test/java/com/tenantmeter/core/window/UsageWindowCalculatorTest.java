package com.tenantmeter.core.window;

import com.tenantmeter.core.model.UsageWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UsageWindowCalculatorTest {

    private final UsageWindowCalculator calculator = new UsageWindowCalculator();

    @Test
    @DisplayName("Before the cutoff both yesterday and today are computed, oldest first")
    void testEarlyMorningHasTwoWindows() {
        Instant now = Instant.parse("2026-10-19T03:15:00Z");

        List<UsageWindow> windows = calculator.windowsAt(now);

        assertEquals(2, windows.size());
        assertEquals(Instant.parse("2026-10-18T00:00:00Z"), windows.get(0).getStart());
        assertEquals(Instant.parse("2026-10-19T00:00:00Z"), windows.get(0).getEnd());
        assertEquals(86400, windows.get(0).getRangeSeconds());

        assertEquals(Instant.parse("2026-10-19T00:00:00Z"), windows.get(1).getStart());
        assertEquals(Instant.parse("2026-10-20T00:00:00Z"), windows.get(1).getEnd());
        assertEquals(3 * 3600 + 15 * 60, windows.get(1).getRangeSeconds());
    }

    @Test
    @DisplayName("The cutoff hour itself still recomputes yesterday")
    void testCutoffHourInclusive() {
        assertEquals(2, calculator.windowsAt(Instant.parse("2026-10-19T05:59:59Z")).size());
        assertEquals(1, calculator.windowsAt(Instant.parse("2026-10-19T06:00:00Z")).size());
    }

    @Test
    @DisplayName("After the cutoff only today is computed")
    void testAfternoonHasOneWindow() {
        Instant now = Instant.parse("2026-10-19T14:00:00Z");

        List<UsageWindow> windows = calculator.windowsAt(now);

        assertEquals(1, windows.size());
        UsageWindow today = windows.get(0);
        assertEquals(Instant.parse("2026-10-19T00:00:00Z"), today.getStart());
        assertEquals(14 * 3600, today.getRangeSeconds());
        assertEquals("1d", today.getDurationLabel());
    }

    @Test
    @DisplayName("Range never exceeds a day and never goes negative")
    void testRangeBounds() {
        Instant dayStart = Instant.parse("2026-10-18T00:00:00Z");

        assertEquals(86400, calculator.windowOf(dayStart, Instant.parse("2026-10-25T12:00:00Z")).getRangeSeconds());
        assertEquals(0, calculator.windowOf(dayStart, Instant.parse("2026-10-17T23:00:00Z")).getRangeSeconds());
        assertEquals(0, calculator.windowOf(dayStart, dayStart).getRangeSeconds());
    }

    @Test
    @DisplayName("Every hour of the day yields windows starting at UTC midnight with bounded ranges")
    void testAllHours() {
        for (int hour = 0; hour < 24; hour++) {
            Instant now = Instant.parse("2026-10-19T00:30:00Z").plusSeconds(hour * 3600L);

            List<UsageWindow> windows = calculator.windowsAt(now);

            assertEquals(hour <= 5 ? 2 : 1, windows.size(), "hour " + hour);
            for (UsageWindow window : windows) {
                assertEquals(0, window.getStart().getEpochSecond() % 86400);
                assertTrue(window.getStart().isBefore(window.getEnd()));
                assertTrue(window.getRangeSeconds() >= 0 && window.getRangeSeconds() <= 86400);
            }
        }
    }

    @Test
    @DisplayName("Custom cutoff hour is honored and validated")
    void testCustomCutoff() {
        UsageWindowCalculator noCorrection = new UsageWindowCalculator(0);

        assertEquals(2, noCorrection.windowsAt(Instant.parse("2026-10-19T00:10:00Z")).size());
        assertEquals(1, noCorrection.windowsAt(Instant.parse("2026-10-19T01:00:00Z")).size());
        assertThrows(IllegalArgumentException.class, () -> new UsageWindowCalculator(24));
    }
}
