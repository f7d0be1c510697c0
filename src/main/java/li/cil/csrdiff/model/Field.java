package li.cil.csrdiff.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import li.cil.csrdiff.range.BitRange;
import li.cil.csrdiff.utils.BitUtils;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

/**
 * A named, contiguous bit range within a register.
 * <p>
 * Everything but the access type and legal values is fixed at construction. Those two are assigned at
 * most once, through {@link #setAccessTypeIfAbsent(AccessType, JsonNode)}.
 */
public final class Field {
    public final String name;
    public final int msb;
    public final int lsb;
    public final String description;
    public final String type;
    @Nullable public final JsonNode resetValue;
    public final String alias;

    private AccessType accessType = AccessType.UNSET;
    @Nullable private JsonNode legalValues;

    public Field(final String name, final BitRange range) {
        this(name, range, "", "", null, "");
    }

    public Field(final String name,
                 final BitRange range,
                 @Nullable final String description,
                 @Nullable final String type,
                 @Nullable final JsonNode resetValue,
                 @Nullable final String alias) {
        this.name = name;
        this.msb = range.msb;
        this.lsb = range.lsb;
        this.description = normalizeDescription(description);
        this.type = StringUtils.defaultString(type);
        this.resetValue = resetValue;
        this.alias = StringUtils.defaultString(alias);
    }

    public int width() {
        return msb - lsb + 1;
    }

    public long mask() {
        return BitUtils.mask(msb, lsb);
    }

    public BitRange range() {
        return BitRange.of(msb, lsb);
    }

    public boolean containsAny(final long mask) {
        return (mask() & mask) != 0;
    }

    public long changedBits(final long xorMask) {
        return mask() & xorMask;
    }

    public long extract(final long value) {
        return (value & mask()) >>> lsb;
    }

    public AccessType getAccessType() {
        return accessType;
    }

    @Nullable
    public JsonNode getLegalValues() {
        return legalValues;
    }

    /**
     * Assigns the access type and legal values of this field, unless an access type was assigned before.
     * <p>
     * Assigning {@link AccessType#UNSET} is a no-op.
     *
     * @param accessType  the access type to assign.
     * @param legalValues the legal-value payload accompanying the access type, if any.
     * @return {@code true} if the field was updated; {@code false} if it already had an access type.
     */
    public boolean setAccessTypeIfAbsent(final AccessType accessType, @Nullable final JsonNode legalValues) {
        if (this.accessType != AccessType.UNSET || accessType == AccessType.UNSET) {
            return false;
        }
        this.accessType = accessType;
        this.legalValues = legalValues;
        return true;
    }

    public ObjectNode toJson() {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("name", name);
        node.put("msb", msb);
        node.put("lsb", lsb);
        node.put("width", width());
        node.put("desc", description);
        node.put("type", type);
        node.set("reset_value", resetValue != null ? resetValue : NullNode.getInstance());
        node.put("alias", alias);
        node.put("mask", BitUtils.toHex(mask()));
        if (accessType != AccessType.UNSET) {
            node.put("access_type", accessType.toString());
            node.set("legal_values", legalValues != null ? legalValues : NullNode.getInstance());
        }
        return node;
    }

    @Override
    public String toString() {
        return name + range();
    }

    private static String normalizeDescription(@Nullable final String description) {
        return StringUtils.replaceChars(StringUtils.strip(StringUtils.defaultString(description)), '\n', ' ');
    }
}
