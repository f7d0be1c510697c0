package li.cil.csrdiff.utils;

public final class BitUtils {
    public static final int MAX_BIT_INDEX = 63;

    /**
     * Computes a mask of {@code msb - lsb + 1} contiguous one-bits starting at {@code lsb}.
     *
     * @param msb the most significant bit of the range (inclusive).
     * @param lsb the least significant bit of the range (inclusive).
     * @return the mask covering the range.
     */
    public static long mask(final int msb, final int lsb) {
        final int width = msb - lsb + 1;
        if (width >= 64) {
            return -1L;
        }
        return ((1L << width) - 1) << lsb;
    }

    public static long extract(final long value, final int msb, final int lsb) {
        return (value & mask(msb, lsb)) >>> lsb;
    }

    public static int popCount(final long value) {
        return Long.bitCount(value);
    }

    /**
     * Renders an unsigned value as {@code 0x} prefixed lower-case hex without padding, e.g. {@code 0x0}.
     */
    public static String toHex(final long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * Renders an unsigned value as {@code 0b} prefixed binary without padding, e.g. {@code 0b101}.
     */
    public static String toBinary(final long value) {
        return "0b" + Long.toBinaryString(value);
    }

    /**
     * Renders a register value as zero-padded hex for the given register width.
     */
    public static String toPaddedHex(final long value, final int xlen) {
        final int digits = Math.max(1, (xlen + 3) / 4);
        final long shown = xlen >= 64 ? value : value & mask(xlen - 1, 0);
        return "0x" + String.format("%0" + digits + "x", shown);
    }

    private BitUtils() {
    }
}
