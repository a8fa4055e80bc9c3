package com.tenantmeter.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SampleValuesTest {

    @Test
    void testParsesNumbers() {
        assertEquals(0.25, SampleValues.parseOrZero("0.25"));
        assertEquals(1.5e9, SampleValues.parseOrZero("1.5e+09"));
        assertEquals(42.0, SampleValues.parseOrZero(" 42 "));
    }

    @Test
    void testSpecialAndMalformedValuesBecomeZero() {
        assertEquals(0.0, SampleValues.parseOrZero("NaN"));
        assertEquals(0.0, SampleValues.parseOrZero("+Inf"));
        assertEquals(0.0, SampleValues.parseOrZero("-Inf"));
        assertEquals(0.0, SampleValues.parseOrZero("abc"));
        assertEquals(0.0, SampleValues.parseOrZero(""));
        assertEquals(0.0, SampleValues.parseOrZero(null));
    }
}
