package FMIndex;

import utilities.PatternResult;

/**
 * Optional per-index query statistics. Nothing is recorded unless collection is enabled; when it is,
 * updates are synchronized so concurrent queries may share one instance.
 */
public final class BWTIndexStats {

    private final boolean collectStats;
    private long queryCount;
    private long totalQueryTimeNanos;
    private long totalBranchExpansions;
    private long totalOccurrences;
    private PatternResult latestPatternResult;

    public BWTIndexStats(boolean collectStats) {
        this.collectStats = collectStats;
    }

    public boolean isCollecting() {
        return collectStats;
    }

    public synchronized void record(PatternResult result, long elapsedNanos) {
        if (!collectStats) {
            return;
        }
        queryCount++;
        totalQueryTimeNanos += elapsedNanos;
        totalBranchExpansions += result.branchExpansions();
        totalOccurrences += result.occurrences();
        latestPatternResult = result;
    }

    public synchronized long queryCount() {
        return queryCount;
    }

    public synchronized long totalQueryTimeNanos() {
        return totalQueryTimeNanos;
    }

    public synchronized long totalBranchExpansions() {
        return totalBranchExpansions;
    }

    public synchronized long totalOccurrences() {
        return totalOccurrences;
    }

    public synchronized double averageQueryTimeMs() {
        return queryCount == 0 ? 0.0 : (totalQueryTimeNanos / 1_000_000.0) / queryCount;
    }

    public synchronized PatternResult latestPatternResult() {
        return latestPatternResult;
    }

    public synchronized void reset() {
        queryCount = 0;
        totalQueryTimeNanos = 0;
        totalBranchExpansions = 0;
        totalOccurrences = 0;
        latestPatternResult = null;
    }
}
