package search;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A query: the pattern bytes plus the number of substitutions a match may contain.
 */
public class Pattern {
    public final byte[] text;
    public final String patternTxt;
    public final int mismatches;
    public final int size;

    public Pattern(String s) {
        this(s, 0);
    }

    public Pattern(String s, int mismatches) {
        this(Objects.requireNonNull(s, "pattern").getBytes(StandardCharsets.UTF_8), mismatches, s);
    }

    public Pattern(byte[] bytes, int mismatches) {
        this(bytes, mismatches, new String(Objects.requireNonNull(bytes, "pattern"), StandardCharsets.ISO_8859_1));
    }

    private Pattern(byte[] bytes, int mismatches, String patternTxt) {
        this.text = bytes.clone();
        this.patternTxt = patternTxt;
        this.mismatches = mismatches;
        this.size = bytes.length;
    }

    public boolean isExact() {
        return mismatches == 0;
    }

    @Override
    public String toString() {
        return mismatches == 0 ? patternTxt : patternTxt + " (k=" + mismatches + ")";
    }
}
