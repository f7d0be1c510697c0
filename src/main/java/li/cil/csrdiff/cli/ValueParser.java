package li.cil.csrdiff.cli;

import java.util.Locale;

public final class ValueParser {
    /**
     * Parses a register value given as {@code 0x} hex, {@code 0b} binary, {@code 0o} octal or decimal.
     * <p>
     * Values are unsigned 64-bit; underscores are accepted as digit separators.
     *
     * @param text the value to parse.
     * @return the parsed value.
     * @throws IllegalArgumentException if the value is not a valid unsigned 64-bit number.
     */
    public static long parse(final String text) {
        final String value = text.trim().replace("_", "").toLowerCase(Locale.ROOT);
        try {
            if (value.startsWith("0x")) {
                return Long.parseUnsignedLong(value.substring(2), 16);
            }
            if (value.startsWith("0b")) {
                return Long.parseUnsignedLong(value.substring(2), 2);
            }
            if (value.startsWith("0o")) {
                return Long.parseUnsignedLong(value.substring(2), 8);
            }
            return Long.parseUnsignedLong(value, 10);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid value [%s].", text), e);
        }
    }

    private ValueParser() {
    }
}
