package utilities;

import FMIndex.BWTIndex;
import FMIndex.BWTIndexConfiguration;
import rank.RankIndex;
import search.Pattern;
import suffixarray.NaiveSuffixArraySupplier;
import suffixarray.SAISSuffixArraySupplier;
import suffixarray.SuffixArraySupplier;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Objects;

/**
 * Central place to construct indexes from string tokens.
 */
public final class IndexFactory {

    private IndexFactory() {}

    public static BWTIndex createIndex(byte[] text) {
        return createIndex(text, BWTIndexConfiguration.BACKTRACK, "sais", RankIndex.DEFAULT_CHECKPOINT_INTERVAL);
    }

    public static BWTIndex createIndex(byte[] text, String algorithm) {
        return createIndex(text, algorithm, "sais", RankIndex.DEFAULT_CHECKPOINT_INTERVAL);
    }

    /**
     * @param algorithm          "backtrack" or "mutations"
     * @param suffixArray        "sais" or "naive"
     * @param checkpointInterval rows between rank checkpoints
     */
    public static BWTIndex createIndex(byte[] text, String algorithm, String suffixArray, int checkpointInterval) {
        BWTIndexConfiguration configuration = BWTIndexConfiguration.builder()
                .searchAlgorithm(algorithm == null ? BWTIndexConfiguration.BACKTRACK : algorithm)
                .suffixArraySupplier(suffixArraySupplier(suffixArray))
                .checkpointInterval(checkpointInterval)
                .build();
        return BWTIndex.build(text, configuration);
    }

    public static SuffixArraySupplier suffixArraySupplier(String token) {
        String t = (token == null) ? "sais" : token.toLowerCase(Locale.ROOT);
        return switch (t) {
            case "sais" -> new SAISSuffixArraySupplier();
            case "naive" -> new NaiveSuffixArraySupplier();
            default -> throw new IllegalArgumentException("unknown suffix array supplier '" + token + "'");
        };
    }

    /**
     * One-shot search: indexes {@code reference} and reports where {@code query} occurs with at most
     * {@code mismatches} substitutions. Build an index once instead when querying repeatedly.
     */
    public static ArrayList<Integer> match(String reference, String query, int mismatches) {
        Objects.requireNonNull(reference, "reference");
        BWTIndex index = BWTIndex.build(reference.getBytes(StandardCharsets.UTF_8));
        return index.report(new Pattern(query, mismatches));
    }

    public static ArrayList<Integer> match(String reference, String query) {
        return match(reference, query, 0);
    }
}
