package FMIndex;

import search.InvalidBudgetException;
import search.Pattern;
import utilities.PatternResult;

import java.util.ArrayList;
import java.util.Objects;

// Brute-force baseline: checks every alignment of the pattern against the text by Hamming distance.
public class LinearScanIndex implements IBWTIndexing {

    private final byte[] text;
    private PatternResult latest;

    public LinearScanIndex(byte[] text) {
        this.text = Objects.requireNonNull(text, "text").clone();
    }

    @Override
    public ArrayList<Integer> report(Pattern key) {
        if (key.mismatches < 0) {
            throw new InvalidBudgetException(key.mismatches);
        }
        long start = System.nanoTime();
        ArrayList<Integer> positions = new ArrayList<>();
        int m = key.size;
        long compared = 0;
        // An empty pattern matches at every text offset.
        for (int i = 0; i + m <= text.length; i++) {
            if (m == 0 && i == text.length) break;
            int mismatches = 0;
            for (int j = 0; j < m && mismatches <= key.mismatches; j++) {
                compared++;
                if (text[i + j] != key.text[j]) mismatches++;
            }
            if (mismatches <= key.mismatches) {
                positions.add(i);
            }
        }
        latest = new PatternResult(key, "scan", 0, positions.size(), compared, (System.nanoTime() - start) / 1e6);
        return positions;
    }

    @Override
    public int count(Pattern key) {
        return report(key).size();
    }

    @Override
    public int length() {
        return text.length;
    }

    @Override
    public PatternResult getLatestStats() {
        return latest;
    }
}
