package transform;

import rank.RankIndex;
import utilities.Alphabet;

/**
 * Rebuilds the original text from the BWT with the LF mapping.
 *
 * Row 0 is the sentinel-only suffix, so its BWT symbol is the last text byte; each LF step moves to
 * the row of the suffix starting one byte earlier.
 */
public final class InverseBWT {

    private InverseBWT() {
    }

    public static byte[] invert(BWTData data) {
        return invert(new RankIndex(data.bwt(), data.alphabet().size()), data.cTable(), data.alphabet());
    }

    public static byte[] invert(RankIndex rankIndex, CTable cTable, Alphabet alphabet) {
        int n = rankIndex.length() - 1;
        byte[] text = new byte[n];
        int row = 0;
        for (int k = n - 1; k >= 0; k--) {
            int symbol = rankIndex.symbolAt(row);
            if (symbol == Alphabet.SENTINEL) {
                throw new IllegalStateException("reached the sentinel with " + (k + 1) + " bytes left to decode");
            }
            text[k] = alphabet.byteOf(symbol);
            row = lf(rankIndex, cTable, row);
        }
        return text;
    }

    /** Row of the suffix that starts one position before the suffix at {@code row}. */
    public static int lf(RankIndex rankIndex, CTable cTable, int row) {
        int symbol = rankIndex.symbolAt(row);
        return cTable.get(symbol) + rankIndex.rank(symbol, row);
    }
}
