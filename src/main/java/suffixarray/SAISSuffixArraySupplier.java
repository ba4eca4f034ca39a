package suffixarray;

import java.util.Arrays;
import java.util.Objects;

/**
 * SA-IS (Nong-Zhang-Chan) suffix array construction in O(n) time.
 *
 * The text is lifted to an integer alphabet where every byte is shifted up by one and a unique 0
 * sentinel is appended, so the induced-sorting core sees a string whose last symbol is the
 * strict minimum. The resulting order is exactly the sentinel-terminated order the index needs.
 */
public final class SAISSuffixArraySupplier implements SuffixArraySupplier {

    private static final int EMPTY = -1;

    @Override
    public int[] suffixArray(byte[] text) {
        Objects.requireNonNull(text, "text");
        int[] s = SuffixArrays.withSentinel(text);
        int maxSymbol = 0;
        for (int v : s) {
            if (v > maxSymbol) maxSymbol = v;
        }
        return build(s, maxSymbol);
    }

    /**
     * Suffix array of {@code s}, which must end with a unique 0 and hold symbols in
     * {@code [0, maxSymbol]}.
     */
    static int[] build(int[] s, int maxSymbol) {
        final int n = s.length;
        int[] sa = new int[n];
        if (n == 1) {
            sa[0] = 0;
            return sa;
        }

        boolean[] sType = classify(s);
        int[] bucketSizes = new int[maxSymbol + 1];
        for (int v : s) bucketSizes[v]++;

        // Stage 1: LMS positions in text order, then induce to sort LMS substrings.
        Arrays.fill(sa, EMPTY);
        int[] tails = bucketTails(bucketSizes);
        for (int i = 1; i < n; i++) {
            if (isLms(sType, i)) {
                sa[tails[s[i]]--] = i;
            }
        }
        induceLType(s, sa, sType, bucketSizes);
        induceSType(s, sa, sType, bucketSizes);

        // Stage 2: name the sorted LMS substrings and sort the reduced string.
        int lmsCount = 0;
        for (int i = 1; i < n; i++) {
            if (isLms(sType, i)) lmsCount++;
        }
        int[] sortedLms = new int[lmsCount];
        int k = 0;
        for (int pos : sa) {
            if (isLms(sType, pos)) sortedLms[k++] = pos;
        }

        int[] names = new int[n];
        Arrays.fill(names, EMPTY);
        int name = 0;
        names[sortedLms[0]] = name;
        for (int i = 1; i < lmsCount; i++) {
            if (!equalLmsSubstrings(s, sType, sortedLms[i - 1], sortedLms[i])) {
                name++;
            }
            names[sortedLms[i]] = name;
        }

        int[] lmsPositions = new int[lmsCount];
        int[] reduced = new int[lmsCount];
        k = 0;
        for (int i = 1; i < n; i++) {
            if (isLms(sType, i)) {
                lmsPositions[k] = i;
                reduced[k++] = names[i];
            }
        }

        int[] reducedSa;
        if (name + 1 == lmsCount) {
            reducedSa = new int[lmsCount];
            for (int i = 0; i < lmsCount; i++) {
                reducedSa[reduced[i]] = i;
            }
        } else {
            reducedSa = build(reduced, name);
        }

        // Stage 3: place LMS suffixes in their final order and induce the rest.
        Arrays.fill(sa, EMPTY);
        tails = bucketTails(bucketSizes);
        for (int i = lmsCount - 1; i >= 0; i--) {
            int pos = lmsPositions[reducedSa[i]];
            sa[tails[s[pos]]--] = pos;
        }
        induceLType(s, sa, sType, bucketSizes);
        induceSType(s, sa, sType, bucketSizes);
        return sa;
    }

    private static boolean[] classify(int[] s) {
        final int n = s.length;
        boolean[] sType = new boolean[n];
        sType[n - 1] = true;
        for (int i = n - 2; i >= 0; i--) {
            if (s[i] < s[i + 1]) {
                sType[i] = true;
            } else if (s[i] == s[i + 1]) {
                sType[i] = sType[i + 1];
            }
        }
        return sType;
    }

    private static boolean isLms(boolean[] sType, int i) {
        return i > 0 && sType[i] && !sType[i - 1];
    }

    private static int[] bucketHeads(int[] bucketSizes) {
        int[] heads = new int[bucketSizes.length];
        int sum = 0;
        for (int c = 0; c < bucketSizes.length; c++) {
            heads[c] = sum;
            sum += bucketSizes[c];
        }
        return heads;
    }

    private static int[] bucketTails(int[] bucketSizes) {
        int[] tails = new int[bucketSizes.length];
        int sum = 0;
        for (int c = 0; c < bucketSizes.length; c++) {
            sum += bucketSizes[c];
            tails[c] = sum - 1;
        }
        return tails;
    }

    private static void induceLType(int[] s, int[] sa, boolean[] sType, int[] bucketSizes) {
        int[] heads = bucketHeads(bucketSizes);
        for (int i = 0; i < sa.length; i++) {
            int j = sa[i] - 1;
            if (j >= 0 && !sType[j]) {
                sa[heads[s[j]]++] = j;
            }
        }
    }

    private static void induceSType(int[] s, int[] sa, boolean[] sType, int[] bucketSizes) {
        int[] tails = bucketTails(bucketSizes);
        for (int i = sa.length - 1; i >= 0; i--) {
            int j = sa[i] - 1;
            if (j >= 0 && sType[j]) {
                sa[tails[s[j]]--] = j;
            }
        }
    }

    // Two LMS substrings are equal when symbols and types agree up to and including the next LMS.
    private static boolean equalLmsSubstrings(int[] s, boolean[] sType, int a, int b) {
        final int n = s.length;
        for (int d = 0; ; d++) {
            int i = a + d;
            int j = b + d;
            if (i >= n || j >= n) {
                return false;
            }
            if (s[i] != s[j] || sType[i] != sType[j]) {
                return false;
            }
            if (d > 0) {
                boolean endA = isLms(sType, i);
                boolean endB = isLms(sType, j);
                if (endA || endB) {
                    return endA && endB;
                }
            }
        }
    }
}
