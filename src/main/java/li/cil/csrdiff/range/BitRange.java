package li.cil.csrdiff.range;

import li.cil.csrdiff.utils.BitUtils;

import java.util.Objects;

/**
 * A canonical, inclusive bit range inside a 64-bit register value.
 */
public final class BitRange {
    public static BitRange of(final int a, final int b) {
        return new BitRange(Math.max(a, b), Math.min(a, b));
    }

    public static BitRange single(final int bit) {
        return new BitRange(bit, bit);
    }

    /**
     * The most significant bit of this range (inclusive).
     */
    public final int msb;

    /**
     * The least significant bit of this range (inclusive).
     */
    public final int lsb;

    private BitRange(final int msb, final int lsb) {
        if (lsb < 0 || msb > BitUtils.MAX_BIT_INDEX) {
            throw new IllegalArgumentException(String.format("Bit range [%d:%d] exceeds [63:0].", msb, lsb));
        }
        this.msb = msb;
        this.lsb = lsb;
    }

    public int width() {
        return msb - lsb + 1;
    }

    public long mask() {
        return BitUtils.mask(msb, lsb);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final BitRange that = (BitRange) o;
        return msb == that.msb &&
               lsb == that.lsb;
    }

    @Override
    public int hashCode() {
        return Objects.hash(msb, lsb);
    }

    @Override
    public String toString() {
        return msb == lsb ? String.format("[%d]", msb) : String.format("[%d:%d]", msb, lsb);
    }
}
