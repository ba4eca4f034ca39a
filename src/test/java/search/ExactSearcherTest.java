package search;

import datagenerators.TextGenerator;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.Test;
import utilities.Alphabet;

import static org.assertj.core.api.Assertions.*;

class ExactSearcherTest {

    private final SearchFixture abracadabra = SearchFixture.of("abracadabra");

    @Test void abra_resolvesToBothOccurrences() {
        SearchInterval interval = abracadabra.exact.exactMatch(abracadabra.symbols("abra"));
        assertThat(interval.size()).isEqualTo(2);
        assertThat(abracadabra.resolver.resolve(interval)).containsExactly(0, 7);
    }

    @Test void singleSymbolAndSuffixPatterns() {
        assertThat(abracadabra.resolver.resolve(abracadabra.exact.exactMatch(abracadabra.symbols("a"))))
                .containsExactly(0, 3, 5, 7, 10);
        assertThat(abracadabra.resolver.resolve(abracadabra.exact.exactMatch(abracadabra.symbols("bra"))))
                .containsExactly(1, 8);
        assertThat(abracadabra.resolver.resolve(abracadabra.exact.exactMatch(abracadabra.symbols("abracadabra"))))
                .containsExactly(0);
    }

    @Test void absentPattern_yieldsEmptyInterval() {
        assertThat(abracadabra.exact.exactMatch(abracadabra.symbols("abrc")).isEmpty()).isTrue();
        assertThat(abracadabra.exact.exactMatch(abracadabra.symbols("abracadabraa")).isEmpty()).isTrue();
    }

    @Test void unknownSymbol_isNoMatchNotAnError() {
        int[] symbols = abracadabra.symbols("abz");
        assertThat(symbols[2]).isEqualTo(Alphabet.UNKNOWN);
        assertThat(abracadabra.exact.exactMatch(symbols)).isEqualTo(SearchInterval.EMPTY);
    }

    @Test void sentinelSymbol_neverMatches() {
        assertThat(abracadabra.exact.exactMatch(new int[]{Alphabet.SENTINEL}).isEmpty()).isTrue();
    }

    @Test void emptyPattern_returnsFullInterval() {
        assertThat(abracadabra.exact.exactMatch(new int[0])).isEqualTo(SearchInterval.full(12));
        assertThat(abracadabra.resolver.resolve(SearchInterval.full(12)))
                .containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    }

    @Test void substrings_matchNaiveScan() {
        byte[] text = TextGenerator.generateUniform(2_000, TextGenerator.DNA, 99);
        SearchFixture fixture = new SearchFixture(text, 64);
        for (long seed = 0; seed < 50; seed++) {
            byte[] pattern = TextGenerator.sampleSubstring(text, 1 + (int) (seed % 12), seed);
            SearchInterval interval = fixture.exact.exactMatch(fixture.symbols(pattern));
            assertThat(interval.isEmpty()).isFalse();
            assertThat(fixture.resolver.resolve(interval)).as("seed %d", seed).containsExactlyElementsOf(naiveScan(text, pattern));
        }
    }

    static IntArrayList naiveScan(byte[] text, byte[] pattern) {
        IntArrayList out = new IntArrayList();
        outer:
        for (int i = 0; i + pattern.length <= text.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (text[i + j] != pattern[j]) continue outer;
            }
            out.add(i);
        }
        return out;
    }
}
