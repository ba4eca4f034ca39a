package transform;

import datagenerators.TextGenerator;
import org.junit.jupiter.api.Test;
import suffixarray.SAISSuffixArraySupplier;
import utilities.Alphabet;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class BWTBuilderTest {

    private static final byte[] BANANA = "banana".getBytes(StandardCharsets.US_ASCII);
    private static final int[] BANANA_SA = {6, 5, 3, 1, 0, 4, 2};

    @Test void banana_producesKnownTransform() {
        BWTData data = BWTBuilder.build(BANANA, BANANA_SA);
        Alphabet alphabet = data.alphabet();
        int a = alphabet.symbolOf((byte) 'a');
        int b = alphabet.symbolOf((byte) 'b');
        int n = alphabet.symbolOf((byte) 'n');

        // "annb$aa"
        assertThat(data.bwt()).containsExactly(a, n, n, b, Alphabet.SENTINEL, a, a);
        assertThat(data.length()).isEqualTo(7);
    }

    @Test void banana_cTableCountsSmallerSymbolsIncludingSentinel() {
        CTable c = BWTBuilder.build(BANANA, BANANA_SA).cTable();
        assertThat(c.get(Alphabet.SENTINEL)).isZero();
        assertThat(c.get(1)).isEqualTo(1); // a
        assertThat(c.get(2)).isEqualTo(4); // b
        assertThat(c.get(3)).isEqualTo(5); // n
        assertThat(c.total()).isEqualTo(7);
        assertThat(c.alphabetSize()).isEqualTo(4);
    }

    @Test void cTable_nextEqualsCountPlusOccurrences() {
        byte[] text = TextGenerator.generateZipf(500, TextGenerator.LOWERCASE, 1.1, 42);
        BWTData data = BWTBuilder.build(text, new SAISSuffixArraySupplier().suffixArray(text));
        CTable c = data.cTable();
        for (int s = 0; s < c.alphabetSize(); s++) {
            final int symbol = s;
            long occ = Arrays.stream(data.bwt()).filter(v -> v == symbol).count();
            assertThat(c.get(s) + occ).as("symbol %d", s).isEqualTo(c.next(s));
        }
    }

    @Test void bwt_isPermutationOfTextPlusSentinel() {
        byte[] text = TextGenerator.generateUniform(300, TextGenerator.DNA, 7);
        BWTData data = BWTBuilder.build(text, new SAISSuffixArraySupplier().suffixArray(text));
        int[] fromText = new int[text.length + 1];
        for (int i = 0; i < text.length; i++) {
            fromText[i] = data.alphabet().symbolOf(text[i]);
        }
        fromText[text.length] = Alphabet.SENTINEL;

        int[] sortedBwt = data.bwt().clone();
        Arrays.sort(sortedBwt);
        Arrays.sort(fromText);
        assertThat(sortedBwt).containsExactly(fromText);
    }

    @Test void symbolAtRow_returnsFirstColumn() {
        CTable c = BWTBuilder.build(BANANA, BANANA_SA).cTable();
        // F column of banana$: $ a a a b n n
        assertThat(c.symbolAtRow(0)).isEqualTo(Alphabet.SENTINEL);
        assertThat(c.symbolAtRow(1)).isEqualTo(1);
        assertThat(c.symbolAtRow(3)).isEqualTo(1);
        assertThat(c.symbolAtRow(4)).isEqualTo(2);
        assertThat(c.symbolAtRow(6)).isEqualTo(3);
        assertThatThrownBy(() -> c.symbolAtRow(7)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test void wrongLength_isRejected() {
        assertThatThrownBy(() -> BWTBuilder.build(BANANA, new int[]{6, 5, 3, 1, 0, 4}))
                .isInstanceOf(InvalidSuffixArrayException.class)
                .hasMessageContaining("expected 7");
    }

    @Test void duplicateEntry_isRejected() {
        assertThatThrownBy(() -> BWTBuilder.build(BANANA, new int[]{6, 5, 3, 1, 0, 4, 4}))
                .isInstanceOf(InvalidSuffixArrayException.class)
                .hasMessageContaining("repeats position 4");
    }

    @Test void outOfRangeEntry_isRejected() {
        assertThatThrownBy(() -> BWTBuilder.build(BANANA, new int[]{6, 5, 3, 1, 0, 4, 7}))
                .isInstanceOf(InvalidSuffixArrayException.class)
                .hasMessageContaining("outside");
        assertThatThrownBy(() -> BWTBuilder.build(BANANA, new int[]{6, 5, 3, 1, 0, 4, -1}))
                .isInstanceOf(InvalidSuffixArrayException.class);
    }

    @Test void unsortedPermutation_isOnlyRejectedWithOrderValidation() {
        int[] swapped = {6, 5, 3, 1, 0, 2, 4};
        assertThatCode(() -> BWTBuilder.build(BANANA, swapped)).doesNotThrowAnyException();
        assertThatThrownBy(() -> BWTBuilder.build(BANANA, swapped, true))
                .isInstanceOf(InvalidSuffixArrayException.class)
                .hasMessageContaining("out of order");
        assertThatCode(() -> BWTBuilder.build(BANANA, BANANA_SA, true)).doesNotThrowAnyException();
    }

    @Test void invalidSuffixArray_isAnIllegalArgument() {
        assertThat(new InvalidSuffixArrayException("x")).isInstanceOf(IllegalArgumentException.class);
    }
}
