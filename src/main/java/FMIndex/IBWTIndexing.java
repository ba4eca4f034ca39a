package FMIndex;

import search.Pattern;
import utilities.PatternResult;

import java.util.ArrayList;

public interface IBWTIndexing {

    /** Ascending, distinct text offsets where the pattern occurs within its mismatch budget. */
    ArrayList<Integer> report(Pattern key);

    int count(Pattern key);

    /** Number of bytes in the indexed text. */
    int length();

    PatternResult getLatestStats();
}
