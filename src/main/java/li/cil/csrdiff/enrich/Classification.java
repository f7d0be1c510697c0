package li.cil.csrdiff.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import li.cil.csrdiff.model.AccessType;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * An access type together with its legal-value payload, as read from a type descriptor.
 */
public final class Classification {
    public static final Classification UNSET = new Classification(AccessType.UNSET, null);

    public final AccessType accessType;
    @Nullable public final JsonNode legalValues;

    public Classification(final AccessType accessType, @Nullable final JsonNode legalValues) {
        this.accessType = accessType;
        this.legalValues = legalValues;
    }

    public boolean isSet() {
        return accessType != AccessType.UNSET;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Classification that = (Classification) o;
        return accessType == that.accessType &&
               Objects.equals(legalValues, that.legalValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessType, legalValues);
    }

    @Override
    public String toString() {
        return legalValues != null ? accessType + "=" + legalValues : accessType.toString();
    }
}
