package utilities;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class AlphabetTest {

    @Test void idsFollowUnsignedByteOrder_afterSentinel() {
        Alphabet alphabet = Alphabet.of(new byte[]{(byte) 0xF0, 'b', 'a', 'b', 0});
        assertThat(alphabet.size()).isEqualTo(5);
        assertThat(alphabet.symbolOf((byte) 0)).isEqualTo(1);
        assertThat(alphabet.symbolOf((byte) 'a')).isEqualTo(2);
        assertThat(alphabet.symbolOf((byte) 'b')).isEqualTo(3);
        assertThat(alphabet.symbolOf((byte) 0xF0)).isEqualTo(4);
        assertThat(alphabet.byteOf(4)).isEqualTo((byte) 0xF0);
    }

    @Test void frequencies_countSentinelOnce() {
        Alphabet alphabet = Alphabet.of("banana".getBytes(StandardCharsets.US_ASCII));
        assertThat(alphabet.frequency(Alphabet.SENTINEL)).isEqualTo(1);
        assertThat(alphabet.frequency(alphabet.symbolOf((byte) 'a'))).isEqualTo(3);
        assertThat(alphabet.frequency(alphabet.symbolOf((byte) 'n'))).isEqualTo(2);
    }

    @Test void unknownBytes() {
        Alphabet alphabet = Alphabet.of("abc".getBytes(StandardCharsets.US_ASCII));
        assertThat(alphabet.contains((byte) 'z')).isFalse();
        assertThat(alphabet.encode("azc".getBytes(StandardCharsets.US_ASCII)))
                .containsExactly(1, Alphabet.UNKNOWN, 3);
        assertThatThrownBy(() -> alphabet.byteOf(Alphabet.SENTINEL)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> alphabet.byteOf(4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test void emptyText_hasOnlySentinel() {
        Alphabet alphabet = Alphabet.of(new byte[0]);
        assertThat(alphabet.size()).isEqualTo(1);
        assertThat(alphabet.symbolOf((byte) 'a')).isEqualTo(Alphabet.UNKNOWN);
    }
}
