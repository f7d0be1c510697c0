package li.cil.csrdiff.decode;

import li.cil.csrdiff.model.Field;
import li.cil.csrdiff.utils.BitUtils;

/**
 * The bits of a single field set in an XOR mask of two register values.
 */
public final class FieldChange {
    public final String name;
    public final int msb;
    public final int lsb;
    public final int width;
    /**
     * The changed bits, in register position.
     */
    public final long changedMask;
    /**
     * The changed bits, shifted so bit 0 is the field's least significant bit.
     */
    public final long changedRelative;
    public final int changedBitCount;
    public final String description;

    FieldChange(final Field field, final long changedMask) {
        this.name = field.name;
        this.msb = field.msb;
        this.lsb = field.lsb;
        this.width = field.width();
        this.changedMask = changedMask;
        this.changedRelative = changedMask >>> field.lsb;
        this.changedBitCount = BitUtils.popCount(changedMask);
        this.description = field.description;
    }

    @Override
    public String toString() {
        return String.format("%s[%d:%d] changed=%s rel=%s bits=%d",
            name, msb, lsb, BitUtils.toHex(changedMask), BitUtils.toHex(changedRelative), changedBitCount);
    }
}
