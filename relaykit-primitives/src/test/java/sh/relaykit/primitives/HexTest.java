// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    @DisplayName("Encoding empty call data and single bytes")
    void encodesBasicValues() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xdead", Hex.encode(new byte[] {(byte) 0xDE, (byte) 0xAD}));
        assertEquals("dead", Hex.encodeNoPrefix(new byte[] {(byte) 0xDE, (byte) 0xAD}));
    }

    @Test
    void decodesEitherCaseWithOrWithoutPrefix() {
        byte[] expected = new byte[] {(byte) 0xCA, (byte) 0xFE};
        assertArrayEquals(expected, Hex.decode("0xcafe"));
        assertArrayEquals(expected, Hex.decode("0XCAFE"));
        assertArrayEquals(expected, Hex.decode("CaFe"));
        assertArrayEquals(new byte[] {}, Hex.decode("0x"));
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xzz"));
        assertThrows(IllegalArgumentException.class, () -> Hex.cleanPrefix(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeNoPrefix(null));
    }

    @Test
    void prefixHandling() {
        assertEquals("1234", Hex.cleanPrefix("0x1234"));
        assertEquals("1234", Hex.cleanPrefix("1234"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("ff"));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void recognisesPrefixedHexCallData() {
        assertTrue(Hex.isPrefixedHex("0x"));
        assertTrue(Hex.isPrefixedHex("0xdead"));
        assertTrue(Hex.isPrefixedHex("0xDEADbeef"));
        assertFalse(Hex.isPrefixedHex("dead"));
        assertFalse(Hex.isPrefixedHex("0xdea"));
        assertFalse(Hex.isPrefixedHex("0xgg"));
        assertFalse(Hex.isPrefixedHex(null));
    }
}
