package com.tenantmeter.core.util;

/**
 * Parsing of raw sample values as returned by the metrics store.
 */
public final class SampleValues {
    private SampleValues() {
    }

    /**
     * Parses a sample value, mapping anything that is not a finite number to {@code 0.0}.
     * <p>
     * The metrics store encodes special values as "NaN", "+Inf" and "-Inf"; neither those nor
     * malformed strings can be reported downstream as JSON numbers.
     * </p>
     *
     * @param raw raw value string, may be null
     * @return parsed finite value or 0.0
     */
    public static double parseOrZero(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0.0;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
