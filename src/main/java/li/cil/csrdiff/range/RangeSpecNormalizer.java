package li.cil.csrdiff.range;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;

/**
 * Converts the bit-range encodings found in register schemas into canonical {@link BitRange}s.
 * <p>
 * Accepted encodings, in detection order:
 * <ul>
 *     <li>an integer {@code n}, giving {@code [n:n]};</li>
 *     <li>a sequence {@code [a, b]}, in either order;</li>
 *     <li>a mapping such as {@code {msb: 31, lsb: 12}}, {@code {hi: 31, lo: 12}} or {@code {from: 12, to: 31}};</li>
 *     <li>text such as {@code "31..12"}, {@code "31:12"} or {@code "31-12"};</li>
 *     <li>text holding a single integer, such as {@code "7"}.</li>
 * </ul>
 * Normalizing a canonical pair returns it unchanged.
 */
public final class RangeSpecNormalizer {
    /**
     * Normalizes a schema value into a bit range.
     *
     * @param raw the location value as it appears in the schema.
     * @return the canonical bit range.
     * @throws MalformedRangeSpecException if the value matches none of the recognized encodings.
     */
    public static BitRange normalize(@Nullable final JsonNode raw) throws MalformedRangeSpecException {
        return tryNormalize(raw).orElseThrow();
    }

    /**
     * Like {@link #normalize(JsonNode)} but reports failure through the result instead of throwing.
     *
     * @param raw the location value as it appears in the schema.
     * @return the resolution of the value.
     */
    public static RangeResolution tryNormalize(@Nullable final JsonNode raw) {
        return resolve(RangeSpec.classify(raw));
    }

    public static RangeResolution resolve(final RangeSpec spec) {
        try {
            return switch (spec.kind) {
                case SCALAR -> {
                    final JsonNode bit = ((RangeSpec.Scalar) spec).bit;
                    yield RangeResolution.success(BitRange.single(toBitIndex(bit)));
                }
                case PAIR -> {
                    final RangeSpec.Pair pair = (RangeSpec.Pair) spec;
                    yield RangeResolution.success(BitRange.of(toBitIndex(pair.first), toBitIndex(pair.second)));
                }
                case KEYED_PAIR -> {
                    final RangeSpec.KeyedPair keyed = (RangeSpec.KeyedPair) spec;
                    if (keyed.high == null || keyed.low == null) {
                        yield RangeResolution.failure(spec.raw, "mapping lacks a high-bit or low-bit key");
                    }
                    yield RangeResolution.success(BitRange.of(toBitIndex(keyed.high), toBitIndex(keyed.low)));
                }
                case DELIMITED_TEXT -> {
                    final RangeSpec.DelimitedText text = (RangeSpec.DelimitedText) spec;
                    yield RangeResolution.success(BitRange.of(toBitIndex(text.first), toBitIndex(text.second)));
                }
                case SCALAR_TEXT -> {
                    final RangeSpec.ScalarText text = (RangeSpec.ScalarText) spec;
                    yield RangeResolution.success(BitRange.single(toBitIndex(text.bit)));
                }
                case UNRECOGNIZED -> RangeResolution.failure(spec.raw, "matches no known range encoding");
            };
        } catch (final IllegalArgumentException e) {
            return RangeResolution.failure(spec.raw, e.getMessage());
        }
    }

    private static int toBitIndex(final long value) {
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(String.format("Bit index [%d] out of range.", value));
        }
        return (int) value;
    }

    private static int toBitIndex(final String value) {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Failed parsing bit index [%s].", value));
        }
    }

    private static int toBitIndex(final JsonNode value) {
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw new IllegalArgumentException(String.format("Bit index [%s] out of range.", value));
            }
            return toBitIndex(value.asLong());
        }
        if (value.isTextual()) {
            return toBitIndex(value.asText().trim());
        }
        throw new IllegalArgumentException(String.format("Bit index [%s] is not an integer.", value));
    }

    private RangeSpecNormalizer() {
    }
}
