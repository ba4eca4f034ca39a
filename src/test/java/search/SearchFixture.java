package search;

import rank.RankIndex;
import suffixarray.SAISSuffixArraySupplier;
import transform.BWTBuilder;
import transform.BWTData;

import java.nio.charset.StandardCharsets;

final class SearchFixture {

    final byte[] text;
    final int[] suffixArray;
    final BWTData data;
    final RankIndex rankIndex;
    final ExactSearcher exact;
    final ApproximateSearcher approximate;
    final MutationSearcher mutations;
    final OccurrencePositionResolver resolver;

    SearchFixture(byte[] text, int checkpointInterval) {
        this.text = text;
        this.suffixArray = new SAISSuffixArraySupplier().suffixArray(text);
        this.data = BWTBuilder.build(text, suffixArray);
        this.rankIndex = new RankIndex(data.bwt(), data.alphabet().size(), checkpointInterval);
        this.exact = new ExactSearcher(rankIndex, data.cTable());
        this.approximate = new ApproximateSearcher(rankIndex, data.cTable());
        this.mutations = new MutationSearcher(exact, data.cTable());
        this.resolver = new OccurrencePositionResolver(suffixArray);
    }

    static SearchFixture of(String text) {
        return new SearchFixture(text.getBytes(StandardCharsets.US_ASCII), 4);
    }

    int[] symbols(String pattern) {
        return data.alphabet().encode(pattern.getBytes(StandardCharsets.US_ASCII));
    }

    int[] symbols(byte[] pattern) {
        return data.alphabet().encode(pattern);
    }
}
