package com.ficshelf.convert;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CountParserTest {

    @Test
    void parsesSiteFormattedCounts() {
        assertEquals(1234, CountParser.parse("1,234"));
        assertEquals(2500, CountParser.parse("2.5k"));
        assertEquals(2500, CountParser.parse(" 2.5K "));
        assertEquals(1234567, CountParser.parse("1.234.567"));
        assertEquals(1500000, CountParser.parse("1.5m"));
        assertEquals(12, CountParser.parse("(12)"));
        assertEquals(7, CountParser.parse("7.9"));
    }

    @Test
    void unusableValuesAreZero() {
        assertEquals(0, CountParser.parse(""));
        assertEquals(0, CountParser.parse("   "));
        assertEquals(0, CountParser.parse((String) null));
        assertEquals(0, CountParser.parse((Object) null));
        assertEquals(0, CountParser.parse("lots"));
        assertEquals(0, CountParser.parse("k"));
        assertEquals(0, CountParser.parse("-40"));
    }

    @Test
    void nonFiniteNumbersDoNotThrow() {
        assertEquals(Integer.MAX_VALUE, CountParser.parse(Double.valueOf(Double.POSITIVE_INFINITY)));
        assertEquals(0, CountParser.parse(Double.valueOf(Double.NEGATIVE_INFINITY)));
        assertEquals(0, CountParser.parse(Double.valueOf(Double.NaN)));
        assertEquals(0, CountParser.parse(Float.valueOf(Float.NaN)));
    }

    @Test
    void numbersPassThroughClamped() {
        assertEquals(42, CountParser.parse(Integer.valueOf(42)));
        assertEquals(3, CountParser.parse(Double.valueOf(3.7)));
        assertEquals(0, CountParser.parse(Long.valueOf(-1)));
        assertEquals(Integer.MAX_VALUE, CountParser.parse(Long.valueOf(10_000_000_000L)));
        assertEquals(Integer.MAX_VALUE, CountParser.parse("5000m"));
    }
}
