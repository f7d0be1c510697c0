package li.cil.csrdiff.decode;

import li.cil.csrdiff.model.Field;
import li.cil.csrdiff.model.RegisterDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decodes register values into field values and field-level changesets.
 * <p>
 * All operations only read the definition, so they may be called concurrently on a definition that is
 * no longer being loaded or enriched. Results are ordered by descending most significant bit; fields
 * sharing a most significant bit keep their declaration order.
 */
public final class DecodeEngine {
    private static final Comparator<Field> BY_MSB_DESCENDING = Comparator.comparingInt((Field f) -> f.msb).reversed();

    /**
     * Extracts the value of every field of the register from the specified value.
     *
     * @param definition the register layout.
     * @param value      the register value.
     * @return one observation per field.
     */
    public static List<FieldObservation> decodeValue(final RegisterDefinition definition, final long value) {
        final List<Field> fields = sortedFields(definition);
        final ArrayList<FieldObservation> result = new ArrayList<>(fields.size());
        for (final Field field : fields) {
            result.add(new FieldObservation(field, field.extract(value)));
        }
        return result;
    }

    /**
     * Lists the fields touched by an XOR mask, typically {@code before ^ after}.
     *
     * @param definition the register layout.
     * @param xorValue   the mask of changed bits.
     * @return one change per field intersecting the mask.
     */
    public static List<FieldChange> decodeXorMask(final RegisterDefinition definition, final long xorValue) {
        final ArrayList<FieldChange> result = new ArrayList<>();
        for (final Field field : sortedFields(definition)) {
            final long changed = field.changedBits(xorValue);
            if (changed != 0) {
                result.add(new FieldChange(field, changed));
            }
        }
        return result;
    }

    /**
     * Lists the fields holding different values in two register values.
     *
     * @param definition the register layout.
     * @param first      the first value, e.g. from a reference model.
     * @param second     the second value, e.g. from the device under test.
     * @return one difference per field whose value differs.
     */
    public static List<FieldDifference> compare(final RegisterDefinition definition, final long first, final long second) {
        final List<FieldObservation> decodedFirst = decodeValue(definition, first);
        final List<FieldObservation> decodedSecond = decodeValue(definition, second);

        final ArrayList<FieldDifference> result = new ArrayList<>();
        for (int i = 0; i < decodedFirst.size(); i++) {
            final FieldObservation a = decodedFirst.get(i);
            final FieldObservation b = decodedSecond.get(i);
            if (a.value != b.value) {
                result.add(new FieldDifference(a, b));
            }
        }
        return result;
    }

    private static List<Field> sortedFields(final RegisterDefinition definition) {
        final ArrayList<Field> fields = new ArrayList<>(definition.getFields());
        fields.sort(BY_MSB_DESCENDING);
        return fields;
    }

    private DecodeEngine() {
    }
}
