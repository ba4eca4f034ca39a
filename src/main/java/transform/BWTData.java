package transform;

import utilities.Alphabet;

/**
 * Output of {@link BWTBuilder}: the transformed string as symbol ids, its C table and the alphabet
 * that maps ids back to bytes.
 *
 * The {@code bwt} array is shared, not copied, with the structures built on top of it and must not
 * be modified.
 */
public record BWTData(int[] bwt, CTable cTable, Alphabet alphabet) {

    public int length() {
        return bwt.length;
    }
}
