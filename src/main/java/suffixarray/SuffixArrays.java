package suffixarray;

/**
 * Helpers shared by the suffix array suppliers and by suffix array validation.
 */
public final class SuffixArrays {

    private SuffixArrays() {
    }

    /**
     * Compares the suffixes of {@code text} starting at {@code a} and {@code b}, where position
     * {@code text.length} is the sentinel suffix. Bytes are unsigned and a suffix that runs out
     * first is the smaller one.
     */
    public static int compareSuffixes(byte[] text, int a, int b) {
        if (a == b) {
            return 0;
        }
        int n = text.length;
        while (a < n && b < n) {
            int ca = text[a] & 0xFF;
            int cb = text[b] & 0xFF;
            if (ca != cb) {
                return ca - cb;
            }
            a++;
            b++;
        }
        return a == n ? -1 : 1;
    }

    /**
     * Maps the text to the integer alphabet used by SA-IS: byte {@code v} becomes {@code v + 1}
     * and a trailing 0 is appended as the unique smallest sentinel.
     */
    static int[] withSentinel(byte[] text) {
        int[] s = new int[text.length + 1];
        for (int i = 0; i < text.length; i++) {
            s[i] = (text[i] & 0xFF) + 1;
        }
        s[text.length] = 0;
        return s;
    }
}
