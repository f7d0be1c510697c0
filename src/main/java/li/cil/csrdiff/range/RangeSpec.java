package li.cil.csrdiff.range;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One of the encodings a schema may use to describe the location of a field.
 * <p>
 * The set of encodings is closed: {@link #classify(JsonNode)} maps every schema value to exactly one
 * variant, in detection priority order, with {@link Unrecognized} catching everything else. Resolution
 * into a {@link BitRange} happens in {@link RangeSpecNormalizer#resolve(RangeSpec)}.
 */
public abstract class RangeSpec {
    public enum Kind {
        SCALAR,
        PAIR,
        KEYED_PAIR,
        DELIMITED_TEXT,
        SCALAR_TEXT,
        UNRECOGNIZED,
    }

    static final String[] HIGH_KEYS = {"msb", "hi", "from", "high"};
    static final String[] LOW_KEYS = {"lsb", "lo", "to", "low"};

    private static final Pattern DELIMITED_PATTERN = Pattern.compile("^(\\d+)\\s*(?:\\.\\.|:|-)\\s*(\\d+)$");
    private static final Pattern SCALAR_PATTERN = Pattern.compile("^(\\d+)$");

    public final Kind kind;
    @Nullable public final JsonNode raw;

    private RangeSpec(final Kind kind, @Nullable final JsonNode raw) {
        this.kind = kind;
        this.raw = raw;
    }

    public static RangeSpec classify(@Nullable final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new Unrecognized(node);
        }

        if (node.isIntegralNumber()) {
            return new Scalar(node);
        }

        if (node.isArray() && node.size() >= 2) {
            return new Pair(node, node.get(0), node.get(1));
        }

        if (node.isObject()) {
            final String highKey = firstPresentKey(node, HIGH_KEYS);
            final String lowKey = firstPresentKey(node, LOW_KEYS);
            return new KeyedPair(node,
                highKey, highKey != null ? node.get(highKey) : null,
                lowKey, lowKey != null ? node.get(lowKey) : null);
        }

        if (node.isTextual()) {
            final String text = node.asText().trim();

            final Matcher delimited = DELIMITED_PATTERN.matcher(text);
            if (delimited.matches()) {
                return new DelimitedText(node, delimited.group(1), delimited.group(2));
            }

            final Matcher scalar = SCALAR_PATTERN.matcher(text);
            if (scalar.matches()) {
                return new ScalarText(node, scalar.group(1));
            }
        }

        return new Unrecognized(node);
    }

    @Nullable
    private static String firstPresentKey(final JsonNode node, final String[] keys) {
        for (final String key : keys) {
            if (node.has(key)) {
                return key;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + "(" + raw + ")";
    }

    /**
     * A single integer {@code n}, meaning the one-bit range {@code [n:n]}.
     */
    public static final class Scalar extends RangeSpec {
        public final JsonNode bit;

        Scalar(final JsonNode raw) {
            super(Kind.SCALAR, raw);
            this.bit = raw;
        }
    }

    /**
     * An ordered sequence whose first two elements are the range endpoints, in any order.
     */
    public static final class Pair extends RangeSpec {
        public final JsonNode first;
        public final JsonNode second;

        Pair(final JsonNode raw, final JsonNode first, final JsonNode second) {
            super(Kind.PAIR, raw);
            this.first = first;
            this.second = second;
        }
    }

    /**
     * A mapping carrying a high-bit key out of {@code msb, hi, from, high} and a low-bit key out of
     * {@code lsb, lo, to, low}. Either side may be missing, in which case resolution fails.
     */
    public static final class KeyedPair extends RangeSpec {
        @Nullable public final String highKey;
        @Nullable public final JsonNode high;
        @Nullable public final String lowKey;
        @Nullable public final JsonNode low;

        KeyedPair(final JsonNode raw,
                  @Nullable final String highKey, @Nullable final JsonNode high,
                  @Nullable final String lowKey, @Nullable final JsonNode low) {
            super(Kind.KEYED_PAIR, raw);
            this.highKey = highKey;
            this.high = high;
            this.lowKey = lowKey;
            this.low = low;
        }
    }

    /**
     * Text of two non-negative integers separated by {@code ..}, {@code :} or {@code -}.
     */
    public static final class DelimitedText extends RangeSpec {
        public final String first;
        public final String second;

        DelimitedText(final JsonNode raw, final String first, final String second) {
            super(Kind.DELIMITED_TEXT, raw);
            this.first = first;
            this.second = second;
        }
    }

    /**
     * Text of a single non-negative integer.
     */
    public static final class ScalarText extends RangeSpec {
        public final String bit;

        ScalarText(final JsonNode raw, final String bit) {
            super(Kind.SCALAR_TEXT, raw);
            this.bit = bit;
        }
    }

    public static final class Unrecognized extends RangeSpec {
        Unrecognized(@Nullable final JsonNode raw) {
            super(Kind.UNRECOGNIZED, raw);
        }
    }
}
