package rank;

/**
 * Occurrence counts over a BWT string with a checkpoint every {@code checkpointInterval} rows.
 *
 * Checkpoint {@code k} holds, for every symbol, its count in {@code bwt[0, k * interval)}. A rank
 * query starts from the checkpoint at or before the position and scans the remaining rows, so it
 * costs at most {@code interval - 1} comparisons. Memory is {@code alphabetSize * (n / interval + 1)}
 * ints on top of the BWT itself.
 */
public final class RankIndex {

    public static final int DEFAULT_CHECKPOINT_INTERVAL = 64;

    private final int[] bwt;
    private final int alphabetSize;
    private final int checkpointInterval;
    // Flattened [checkpoint][symbol].
    private final int[] checkpoints;

    public RankIndex(int[] bwt, int alphabetSize) {
        this(bwt, alphabetSize, DEFAULT_CHECKPOINT_INTERVAL);
    }

    public RankIndex(int[] bwt, int alphabetSize, int checkpointInterval) {
        if (bwt == null) {
            throw new IllegalArgumentException("bwt must be non-null");
        }
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabetSize must be positive");
        }
        if (checkpointInterval <= 0) {
            throw new IllegalArgumentException("checkpointInterval must be positive");
        }
        this.bwt = bwt;
        this.alphabetSize = alphabetSize;
        this.checkpointInterval = checkpointInterval;
        this.checkpoints = buildCheckpoints(bwt, alphabetSize, checkpointInterval);
    }

    private static int[] buildCheckpoints(int[] bwt, int sigma, int interval) {
        int n = bwt.length;
        int[] out = new int[(n / interval + 1) * sigma];
        int[] running = new int[sigma];
        for (int i = 0; i <= n; i++) {
            if (i % interval == 0) {
                System.arraycopy(running, 0, out, (i / interval) * sigma, sigma);
            }
            if (i < n) {
                int symbol = bwt[i];
                if (symbol < 0 || symbol >= sigma) {
                    throw new IllegalArgumentException("bwt[" + i + "] = " + symbol + " outside alphabet of size " + sigma);
                }
                running[symbol]++;
            }
        }
        return out;
    }

    /**
     * Number of occurrences of {@code symbol} in {@code bwt[0, i)}.
     *
     * @throws IndexOutOfBoundsException if {@code i} is outside {@code [0, length()]} or the symbol
     *                                   is outside the alphabet
     */
    public int rank(int symbol, int i) {
        if (i < 0 || i > bwt.length) {
            throw new IndexOutOfBoundsException("rank position " + i + " outside [0, " + bwt.length + "]");
        }
        if (symbol < 0 || symbol >= alphabetSize) {
            throw new IndexOutOfBoundsException("symbol " + symbol + " outside [0, " + alphabetSize + ")");
        }
        int block = i / checkpointInterval;
        int count = checkpoints[block * alphabetSize + symbol];
        for (int p = block * checkpointInterval; p < i; p++) {
            if (bwt[p] == symbol) count++;
        }
        return count;
    }

    /** Stored count of {@code symbol} in {@code bwt[0, k * checkpointInterval())}. */
    public int checkpoint(int symbol, int k) {
        return checkpoints[k * alphabetSize + symbol];
    }

    public int checkpointCount() {
        return checkpoints.length / alphabetSize;
    }

    public int symbolAt(int i) {
        return bwt[i];
    }

    /** Length of the BWT string, n + 1. */
    public int length() {
        return bwt.length;
    }

    public int alphabetSize() {
        return alphabetSize;
    }

    public int checkpointInterval() {
        return checkpointInterval;
    }
}
