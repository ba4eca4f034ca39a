package utilities;

import java.util.Objects;

/**
 * Dense symbol ids for the bytes of one text.
 *
 * Id 0 is reserved for the sentinel. The distinct bytes of the text receive ids {@code 1..size()-1}
 * in ascending unsigned order, so comparing ids compares bytes. Bytes that never occur in the text
 * map to {@link #UNKNOWN}.
 */
public final class Alphabet {

    public static final int SENTINEL = 0;
    public static final int UNKNOWN = -1;

    private final int[] byteToSymbol;
    private final byte[] symbolToByte;
    // Occurrences per symbol id, the sentinel counted once.
    private final int[] frequencies;

    private Alphabet(int[] byteToSymbol, byte[] symbolToByte, int[] frequencies) {
        this.byteToSymbol = byteToSymbol;
        this.symbolToByte = symbolToByte;
        this.frequencies = frequencies;
    }

    public static Alphabet of(byte[] text) {
        Objects.requireNonNull(text, "text");
        int[] byteCounts = new int[256];
        for (byte b : text) {
            byteCounts[b & 0xFF]++;
        }

        int distinct = 0;
        for (int count : byteCounts) {
            if (count > 0) distinct++;
        }

        int[] byteToSymbol = new int[256];
        byte[] symbolToByte = new byte[distinct + 1];
        int[] frequencies = new int[distinct + 1];
        frequencies[SENTINEL] = 1;
        int nextId = 1;
        for (int v = 0; v < 256; v++) {
            if (byteCounts[v] == 0) {
                byteToSymbol[v] = UNKNOWN;
                continue;
            }
            byteToSymbol[v] = nextId;
            symbolToByte[nextId] = (byte) v;
            frequencies[nextId] = byteCounts[v];
            nextId++;
        }
        return new Alphabet(byteToSymbol, symbolToByte, frequencies);
    }

    /** Number of symbol ids, the sentinel included. */
    public int size() {
        return symbolToByte.length;
    }

    public int symbolOf(byte b) {
        return byteToSymbol[b & 0xFF];
    }

    public byte byteOf(int symbol) {
        if (symbol <= SENTINEL || symbol >= symbolToByte.length) {
            throw new IllegalArgumentException("symbol " + symbol + " has no byte form");
        }
        return symbolToByte[symbol];
    }

    public int frequency(int symbol) {
        return frequencies[symbol];
    }

    public boolean contains(byte b) {
        return symbolOf(b) != UNKNOWN;
    }

    /** Maps every byte to its id; bytes outside the alphabet become {@link #UNKNOWN}. */
    public int[] encode(byte[] bytes) {
        int[] symbols = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            symbols[i] = symbolOf(bytes[i]);
        }
        return symbols;
    }
}
