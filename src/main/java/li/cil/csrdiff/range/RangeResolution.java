package li.cil.csrdiff.range;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.NoSuchElementException;

/**
 * Outcome of resolving a {@link RangeSpec}: either a {@link BitRange} or the reason it could not be built.
 */
public final class RangeResolution {
    public static RangeResolution success(final BitRange range) {
        return new RangeResolution(range, null, null);
    }

    public static RangeResolution failure(@Nullable final JsonNode raw, final String reason) {
        return new RangeResolution(null, raw, reason);
    }

    @Nullable private final BitRange range;
    @Nullable private final JsonNode raw;
    @Nullable private final String reason;

    private RangeResolution(@Nullable final BitRange range, @Nullable final JsonNode raw, @Nullable final String reason) {
        this.range = range;
        this.raw = raw;
        this.reason = reason;
    }

    public boolean isSuccess() {
        return range != null;
    }

    public BitRange getRange() {
        if (range == null) {
            throw new NoSuchElementException(reason);
        }
        return range;
    }

    @Nullable
    public String getReason() {
        return reason;
    }

    @Nullable
    public JsonNode getRaw() {
        return raw;
    }

    public BitRange orElseThrow() throws MalformedRangeSpecException {
        if (range == null) {
            throw new MalformedRangeSpecException(raw, reason);
        }
        return range;
    }

    @Override
    public String toString() {
        return isSuccess() ? "success" + range : "failure(" + reason + ")";
    }
}
