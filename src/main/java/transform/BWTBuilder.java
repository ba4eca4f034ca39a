package transform;

import suffixarray.SuffixArrays;
import utilities.Alphabet;
import utilities.BWTLogger;

import java.util.BitSet;
import java.util.Objects;

/**
 * Derives the Burrows-Wheeler transform and the C table of a text from its suffix array.
 */
public final class BWTBuilder {

    private BWTBuilder() {
    }

    public static BWTData build(byte[] text, int[] suffixArray) {
        return build(text, suffixArray, false);
    }

    /**
     * @param validateOrder also check that adjacent suffixes are in order, which costs a walk over
     *                      their common prefixes
     * @throws InvalidSuffixArrayException if {@code suffixArray} is not a suffix array of {@code text}
     */
    public static BWTData build(byte[] text, int[] suffixArray, boolean validateOrder) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(suffixArray, "suffixArray");
        validatePermutation(text.length, suffixArray);
        if (validateOrder) {
            validateOrder(text, suffixArray);
        }

        Alphabet alphabet = Alphabet.of(text);
        int[] bwt = new int[suffixArray.length];
        for (int i = 0; i < suffixArray.length; i++) {
            int pos = suffixArray[i];
            bwt[i] = pos == 0 ? Alphabet.SENTINEL : alphabet.symbolOf(text[pos - 1]);
        }
        return new BWTData(bwt, CTable.of(alphabet), alphabet);
    }

    private static void validatePermutation(int n, int[] suffixArray) {
        if (suffixArray.length != n + 1) {
            throw invalid("suffix array has " + suffixArray.length + " entries, expected " + (n + 1));
        }
        BitSet seen = new BitSet(n + 1);
        for (int i = 0; i < suffixArray.length; i++) {
            int pos = suffixArray[i];
            if (pos < 0 || pos > n) {
                throw invalid("suffix array entry " + i + " = " + pos + " outside [0, " + n + "]");
            }
            if (seen.get(pos)) {
                throw invalid("suffix array repeats position " + pos + " at entry " + i);
            }
            seen.set(pos);
        }
    }

    private static void validateOrder(byte[] text, int[] suffixArray) {
        for (int i = 1; i < suffixArray.length; i++) {
            if (SuffixArrays.compareSuffixes(text, suffixArray[i - 1], suffixArray[i]) > 0) {
                throw invalid("suffixes at entries " + (i - 1) + " and " + i + " are out of order");
            }
        }
    }

    private static InvalidSuffixArrayException invalid(String message) {
        BWTLogger.warning("Rejecting suffix array: " + message);
        return new InvalidSuffixArrayException(message);
    }
}
