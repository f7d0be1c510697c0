package li.cil.csrdiff.decode;

import li.cil.csrdiff.model.Field;
import li.cil.csrdiff.utils.BitUtils;

/**
 * The value a single field holds in a register value.
 */
public final class FieldObservation {
    public final String name;
    public final int msb;
    public final int lsb;
    public final int width;
    public final long value;
    public final String description;

    FieldObservation(final Field field, final long value) {
        this.name = field.name;
        this.msb = field.msb;
        this.lsb = field.lsb;
        this.width = field.width();
        this.value = value;
        this.description = field.description;
    }

    public String hex() {
        return BitUtils.toHex(value);
    }

    public String binary() {
        return BitUtils.toBinary(value);
    }

    @Override
    public String toString() {
        return msb == lsb
            ? String.format("%s[%d]=%s", name, msb, binary())
            : String.format("%s[%d:%d]=%s", name, msb, lsb, binary());
    }
}
