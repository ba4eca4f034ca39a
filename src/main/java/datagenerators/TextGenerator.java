package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.nio.charset.StandardCharsets;

public class TextGenerator {
    public static final byte[] DNA = "ACGT".getBytes(StandardCharsets.US_ASCII);
    public static final byte[] LOWERCASE = "abcdefghijklmnopqrstuvwxyz".getBytes(StandardCharsets.US_ASCII);

    public static byte[] generateUniform(int length, byte[] alphabet, long seed) {
        validate(length, alphabet);
        RandomGenerator rng = new Well19937c(seed);
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = alphabet[rng.nextInt(alphabet.length)];
        }
        return out;
    }

    // Skewed symbol frequencies: alphabet[0] is the most common byte.
    public static byte[] generateZipf(int length, byte[] alphabet, double exponent, long seed) {
        validate(length, alphabet);
        RandomGenerator rng = new Well19937c(seed);
        // ZipfDistribution samples integers in the closed interval [1, alphabet.length]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabet.length, exponent);
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = alphabet[dist.sample() - 1];
        }
        return out;
    }

    // A random substring of text, so that it is guaranteed to occur at least once.
    public static byte[] sampleSubstring(byte[] text, int length, long seed) {
        if (length > text.length) {
            throw new IllegalArgumentException("length exceeds text length");
        }
        RandomGenerator rng = new Well19937c(seed);
        int start = rng.nextInt(text.length - length + 1);
        byte[] out = new byte[length];
        System.arraycopy(text, start, out, 0, length);
        return out;
    }

    private static void validate(int length, byte[] alphabet) {
        if (length < 0) throw new IllegalArgumentException("length < 0");
        if (alphabet == null || alphabet.length == 0) throw new IllegalArgumentException("alphabet must be non-empty");
    }
}
