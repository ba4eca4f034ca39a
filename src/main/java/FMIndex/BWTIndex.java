package FMIndex;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import rank.RankIndex;
import search.ApproximateSearcher;
import search.ExactSearcher;
import search.InvalidBudgetException;
import search.MutationSearcher;
import search.OccurrencePositionResolver;
import search.Pattern;
import search.SearchAlgorithm;
import search.SearchInterval;
import search.SearchResult;
import transform.BWTBuilder;
import transform.BWTData;
import transform.CTable;
import transform.InverseBWT;
import utilities.Alphabet;
import utilities.BWTLogger;
import utilities.PatternResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * FM-index over one static byte text: the BWT with checkpointed rank counts, the C table and the
 * suffix array, answering exact and bounded-substitution substring queries.
 *
 * Instances are built in one pass by the static {@code build} methods and never change afterwards,
 * so a single index can be queried from many threads. A failed build throws and leaves nothing
 * behind; a failed query leaves the index usable.
 */
public final class BWTIndex implements IBWTIndexing {

    private final int textLength;
    private final int[] suffixArray;
    private final Alphabet alphabet;
    private final CTable cTable;
    private final RankIndex rankIndex;
    private final ExactSearcher exactSearcher;
    private final SearchAlgorithm approximateSearcher;
    private final OccurrencePositionResolver resolver;
    private final BWTIndexConfiguration configuration;
    private final BWTIndexStats stats;

    private BWTIndex(int textLength,
                     int[] suffixArray,
                     BWTData data,
                     RankIndex rankIndex,
                     BWTIndexConfiguration configuration) {
        this.textLength = textLength;
        this.suffixArray = suffixArray;
        this.alphabet = data.alphabet();
        this.cTable = data.cTable();
        this.rankIndex = rankIndex;
        this.configuration = configuration;
        this.exactSearcher = new ExactSearcher(rankIndex, cTable);
        this.approximateSearcher = switch (configuration.searchAlgorithm()) {
            case BWTIndexConfiguration.MUTATIONS -> new MutationSearcher(exactSearcher, cTable);
            default -> new ApproximateSearcher(rankIndex, cTable);
        };
        this.resolver = new OccurrencePositionResolver(suffixArray);
        this.stats = new BWTIndexStats(configuration.collectStats());
    }

    public static BWTIndex build(byte[] text) {
        return build(text, null, BWTIndexConfiguration.defaults());
    }

    public static BWTIndex build(byte[] text, int[] suffixArray) {
        return build(text, suffixArray, BWTIndexConfiguration.defaults());
    }

    public static BWTIndex build(byte[] text, BWTIndexConfiguration configuration) {
        return build(text, null, configuration);
    }

    /**
     * Builds an index from {@code text}.
     *
     * @param suffixArray suffix array of the text, or {@code null} to compute it with the configured
     *                    supplier; a supplied array is copied
     * @throws transform.InvalidSuffixArrayException if the suffix array does not fit the text
     */
    public static BWTIndex build(byte[] text, int[] suffixArray, BWTIndexConfiguration configuration) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(configuration, "configuration");
        long start = System.nanoTime();

        int[] sa = suffixArray != null
                ? suffixArray.clone()
                : configuration.suffixArraySupplier().suffixArray(text);
        long saNanos = System.nanoTime() - start;

        BWTData data = BWTBuilder.build(text, sa, configuration.validateSuffixOrder());
        RankIndex rankIndex = new RankIndex(data.bwt(), data.alphabet().size(), configuration.checkpointInterval());
        BWTIndex index = new BWTIndex(text.length, sa, data, rankIndex, configuration);

        long totalNanos = System.nanoTime() - start;
        BWTLogger.info(String.format(Locale.ROOT,
                "Built BWT index: n=%d sigma=%d B=%d search=%s suffixArray=%s (%.3f ms) total=%.3f ms",
                text.length, data.alphabet().size() - 1, configuration.checkpointInterval(),
                configuration.searchAlgorithm(),
                suffixArray != null ? "supplied" : configuration.suffixArraySupplier().getClass().getSimpleName(),
                saNanos / 1e6, totalNanos / 1e6));
        return index;
    }

    public SearchInterval exactMatch(byte[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return exactSearcher.exactMatch(alphabet.encode(pattern));
    }

    /**
     * Every distinct interval matching {@code pattern} with at most {@code maxMismatches}
     * substitutions.
     *
     * @throws InvalidBudgetException if {@code maxMismatches} is negative
     */
    public List<SearchInterval> approximateMatch(byte[] pattern, int maxMismatches) {
        Objects.requireNonNull(pattern, "pattern");
        return approximateSearcher.search(alphabet.encode(pattern), maxMismatches).intervals();
    }

    /** Ascending distinct offsets of all occurrences within {@code maxMismatches} substitutions. */
    public IntSortedSet occurrences(byte[] pattern, int maxMismatches) {
        return occurrences(new Pattern(pattern, maxMismatches));
    }

    public IntSortedSet occurrences(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.mismatches < 0) {
            BWTLogger.warning("Rejecting query '" + pattern.patternTxt + "' with budget " + pattern.mismatches);
            throw new InvalidBudgetException(pattern.mismatches);
        }
        long start = System.nanoTime();
        int[] symbols = alphabet.encode(pattern.text);

        List<SearchInterval> intervals;
        long expansions;
        if (pattern.isExact()) {
            SearchInterval interval = exactSearcher.exactMatch(symbols);
            intervals = interval.isEmpty() ? Collections.emptyList() : List.of(interval);
            expansions = pattern.size;
        } else {
            SearchResult result = approximateSearcher.search(symbols, pattern.mismatches);
            intervals = result.intervals();
            expansions = result.branchExpansions();
        }
        IntSortedSet offsets = resolver.resolve(intervals);

        long elapsed = System.nanoTime() - start;
        if (stats.isCollecting()) {
            String algorithm = pattern.isExact() ? "exact" : approximateSearcher.name();
            stats.record(new PatternResult(pattern, algorithm, intervals.size(), offsets.size(), expansions, elapsed / 1e6), elapsed);
        }
        BWTLogger.debug("Query '" + pattern + "': " + intervals.size() + " intervals, " + offsets.size() + " occurrences");
        return offsets;
    }

    @Override
    public ArrayList<Integer> report(Pattern key) {
        return new ArrayList<>(occurrences(key));
    }

    @Override
    public int count(Pattern key) {
        if (key.isExact()) {
            // Every row of an exact interval is a distinct offset, minus the sentinel row for the empty pattern.
            SearchInterval interval = exactSearcher.exactMatch(alphabet.encode(key.text));
            return key.size == 0 ? textLength : interval.size();
        }
        return occurrences(key).size();
    }

    /** Rebuilds the indexed text from the BWT alone. */
    public byte[] reconstructText() {
        return InverseBWT.invert(rankIndex, cTable, alphabet);
    }

    @Override
    public int length() {
        return textLength;
    }

    /** Distinct bytes in the text, the sentinel not counted. */
    public int alphabetSize() {
        return alphabet.size() - 1;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public CTable cTable() {
        return cTable;
    }

    public RankIndex rankIndex() {
        return rankIndex;
    }

    /** Suffix array row {@code row}, i.e. the text offset of the {@code row}-th smallest suffix. */
    public int suffixAt(int row) {
        return suffixArray[row];
    }

    public BWTIndexConfiguration configuration() {
        return configuration;
    }

    public BWTIndexStats stats() {
        return stats;
    }

    @Override
    public PatternResult getLatestStats() {
        return stats.latestPatternResult();
    }
}
