package utilities;

import index.QuadraticSuffixTreeIndex;
import index.SuffixTreeIndex;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemUtilTest {

    @Test
    void reportCarriesIndexNameAndTotal() {
        SuffixTreeIndex index = new SuffixTreeIndex("GATTACAGATTACA");
        MemoryUsageReport report = MemUtil.jolMemoryReportWithTotal(index, true);

        assertTrue(report.totalBytes() > 0);
        assertEquals(report.totalBytes() / (1024.0 * 1024.0), report.totalMiB(), 1e-12);
        assertTrue(report.report().contains(index.name()));
        assertTrue(report.report().contains("over 14 symbols"));
        assertTrue(report.report().contains("Class footprint"));
        assertTrue(report.report().contains("Total bytes       : " + report.totalBytes() + " B"));
        assertEquals(MemUtil.retainedBytes(index), report.totalBytes());
    }

    @Test
    void largerTextRetainsMore() {
        long small = MemUtil.retainedBytes(new QuadraticSuffixTreeIndex("abcab"));
        long large = MemUtil.retainedBytes(new QuadraticSuffixTreeIndex("abcabxabcdabcabxabcdabcabxabcd"));

        assertTrue(large > small);
    }

    @Test
    void vmDetailsAreOptional() {
        String plain = MemUtil.jolMemoryReport(new SuffixTreeIndex("banana"), false, false);

        assertTrue(plain.startsWith("=== "));
        assertFalse(plain.contains("JOL / VM details"));
    }
}
