package org.faultscan.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void testEscapeCsvField() {
        assertEquals("", Utils.escapeCsvField(null));
        assertEquals("plain", Utils.escapeCsvField("plain"));
        assertEquals("\"a,b\"", Utils.escapeCsvField("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", Utils.escapeCsvField("say \"hi\""));
    }

    @Test
    void testSplitCsvLine() {
        assertEquals(List.of("a", "b", "", "d"), Utils.splitCsvLine("a,b,,d"));
        assertEquals(List.of("1", "x, y", "z"), Utils.splitCsvLine("1,\"x, y\",z"));
        assertEquals(List.of("say \"hi\"", ""), Utils.splitCsvLine("\"say \"\"hi\"\"\","));
        assertEquals(List.of(""), Utils.splitCsvLine(""));
    }

    @Test
    void testSplitReversesEscape() {
        String field = "it's \"quoted\", with commas";
        assertEquals(List.of("a", field), Utils.splitCsvLine("a," + Utils.escapeCsvField(field)));
    }

    @Test
    void testPeakMemoryIsNonNegative() {
        assertTrue(MemoryUsage.peakMemoryMb() >= 0);
    }
}
