package utilities;

// JOL report text together with the measured totals.
public record MemoryUsageReport(String report, long totalBytes, double totalMiB) {}
