package li.cil.csrdiff.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class ValueParserTests {
    @Test
    public void acceptsPrefixedRadixes() {
        assertEquals(0x8000000a00006000L, ValueParser.parse("0x8000000a00006000"));
        assertEquals(0xFFL, ValueParser.parse("0XfF"));
        assertEquals(0b10110101L, ValueParser.parse("0b10110101"));
        assertEquals(8L, ValueParser.parse("0o10"));
        assertEquals(181L, ValueParser.parse(" 181 "));
        assertEquals(0x1234L, ValueParser.parse("0x12_34"));
    }

    @Test
    public void acceptsFullUnsignedRange() {
        assertEquals(-1L, ValueParser.parse("0xffffffffffffffff"));
        assertEquals(-1L, ValueParser.parse("18446744073709551615"));
    }

    @Test
    public void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ValueParser.parse("0xg"));
        assertThrows(IllegalArgumentException.class, () -> ValueParser.parse("0b102"));
        assertThrows(IllegalArgumentException.class, () -> ValueParser.parse("-1"));
        assertThrows(IllegalArgumentException.class, () -> ValueParser.parse("0x1ffffffffffffffff"));
        assertThrows(IllegalArgumentException.class, () -> ValueParser.parse(""));
    }
}
