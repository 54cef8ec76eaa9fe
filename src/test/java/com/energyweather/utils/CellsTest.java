package com.energyweather.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CellsTest {

    @Test
    void parseNumber_shouldReadTextAndNumbers() {
        assertEquals(20000.0, Cells.parseNumber("20000"));
        assertEquals(1234.5, Cells.parseNumber("1,234.5"));
        assertEquals(70.0, Cells.parseNumber(70));
        assertNull(Cells.parseNumber(""));
        assertNull(Cells.parseNumber("nan"));
        assertNull(Cells.parseNumber(null));
    }

    @Test
    void parseNumber_shouldRejectText() {
        assertThrows(NumberFormatException.class, () -> Cells.parseNumber("abc"));
        assertThrows(NumberFormatException.class, () -> Cells.parseNumber(Boolean.TRUE));
    }

    @Test
    void format_shouldBeStableAcrossReads() {
        assertEquals("20000", Cells.format(20000.0));
        assertEquals("60.5", Cells.format(60.5));
        assertEquals("-0.1", Cells.format(-0.1));
        assertEquals("2024-05-01", Cells.format(LocalDate.of(2024, 5, 1)));
        assertEquals("true", Cells.format(Boolean.TRUE));
        assertEquals("", Cells.format(null));
        assertEquals("", Cells.format(Double.NaN));
    }

    @Test
    void isMissing_shouldCoverNullAndNaN() {
        assertTrue(Cells.isMissing(null));
        assertTrue(Cells.isMissing(Double.NaN));
        assertFalse(Cells.isMissing(0.0));
        assertFalse(Cells.isMissing(""));
    }
}
