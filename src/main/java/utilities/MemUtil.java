package utilities;

import FMIndex.BWTIndex;
import org.openjdk.jol.info.GraphLayout;
import rank.RankIndex;

import java.util.Locale;

public class MemUtil {

    private static final double MIB = 1024.0 * 1024.0;

    // Partitioned JOL report: whole index, rank structure (BWT + checkpoints), and the rest.
    public String jolMemoryReport(BWTIndex index, boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4096);

        GraphLayout total = GraphLayout.parseInstance(index);
        RankIndex rankIndex = index.rankIndex();
        long rankBytes = GraphLayout.parseInstance(rankIndex).totalSize();
        long checkpointBytes = (long) rankIndex.checkpointCount() * rankIndex.alphabetSize() * Integer.BYTES;
        long otherBytes = Math.max(0L, total.totalSize() - rankBytes);

        Locale L = Locale.ROOT;
        sb.append(String.format(L, "Total: %d B (%.3f MiB)", total.totalSize(), total.totalSize() / MIB)).append('\n');
        sb.append(String.format(L, "RankIndex (BWT + checkpoints): %d B (%.3f MiB)", rankBytes, rankBytes / MIB)).append('\n');
        sb.append(String.format(L, "  |_ Checkpoints (payload, B=%d): %d B (%.3f MiB)",
                rankIndex.checkpointInterval(), checkpointBytes, checkpointBytes / MIB)).append('\n');
        sb.append(String.format(L, "Suffix array, C table, alphabet, searchers: %d B (%.3f MiB)", otherBytes, otherBytes / MIB));

        if (includeFootprintTable) {
            sb.append("\n\n--- Class footprint (index root) ---\n");
            sb.append(total.toFootprint());
        }
        return sb.toString();
    }

    // Like jolMemoryReport but also returns the total MiB value.
    public MemoryUsageReport jolMemoryReportWithTotal(BWTIndex index) {
        String txt = jolMemoryReport(index, false);
        long totalBytes = GraphLayout.parseInstance(index).totalSize();
        return new MemoryUsageReport(txt, totalBytes / MIB);
    }

    // Checkpoint payload without JOL; alphabetSize counts distinct text bytes, the sentinel is added here.
    public static long estimateCheckpointBytes(int textLength, int alphabetSize, int checkpointInterval) {
        long rows = textLength + 1L;
        long checkpoints = rows / checkpointInterval + 1;
        return checkpoints * (alphabetSize + 1L) * Integer.BYTES;
    }
}
