package utilities;

/** JOL report text for one index, plus its retained size in MiB. */
public record MemoryUsageReport(String report, double totalMiB) {}
