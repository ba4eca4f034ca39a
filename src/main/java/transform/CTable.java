package transform;

import utilities.Alphabet;

import java.util.Arrays;

/**
 * Cumulative symbol counts over the text plus its sentinel: {@code get(s)} is the number of symbols
 * strictly smaller than {@code s}, and {@code get(s) + occ(s) == get(s + 1)}.
 */
public final class CTable {

    // counts[s] for s in [0, sigma]; counts[sigma] is the total length n + 1.
    private final int[] counts;

    private CTable(int[] counts) {
        this.counts = counts;
    }

    /** Exclusive prefix sum of the alphabet's per-symbol frequencies. */
    public static CTable of(Alphabet alphabet) {
        int sigma = alphabet.size();
        int[] counts = new int[sigma + 1];
        for (int s = 0; s < sigma; s++) {
            counts[s + 1] = counts[s] + alphabet.frequency(s);
        }
        return new CTable(counts);
    }

    public int get(int symbol) {
        return counts[symbol];
    }

    /** Count for the symbol after {@code symbol}, i.e. the end of its block of rows. */
    public int next(int symbol) {
        return counts[symbol + 1];
    }

    public int alphabetSize() {
        return counts.length - 1;
    }

    /** Length of the BWT string, n + 1. */
    public int total() {
        return counts[counts.length - 1];
    }

    /** Symbol whose block of sorted rows contains {@code row}, i.e. the first column F at that row. */
    public int symbolAtRow(int row) {
        if (row < 0 || row >= total()) {
            throw new IndexOutOfBoundsException("row " + row + " outside [0, " + total() + ")");
        }
        int idx = Arrays.binarySearch(counts, row);
        // Every symbol occurs at least once, so counts is strictly increasing.
        return idx >= 0 ? idx : -idx - 2;
    }

    @Override
    public String toString() {
        return "CTable" + Arrays.toString(counts);
    }
}
