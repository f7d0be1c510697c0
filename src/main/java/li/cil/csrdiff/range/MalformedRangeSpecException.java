package li.cil.csrdiff.range;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.io.IOException;

/**
 * Thrown when a field location matches none of the recognized range encodings.
 */
public final class MalformedRangeSpecException extends IOException {
    @Nullable private final JsonNode rawValue;

    public MalformedRangeSpecException(@Nullable final JsonNode rawValue, final String reason) {
        super(String.format("Unrecognized bit range [%s]: %s", rawValue, reason));
        this.rawValue = rawValue;
    }

    /**
     * The schema value that failed to normalize, as it appeared in the source document.
     *
     * @return the raw value, or {@code null} if there was none.
     */
    @Nullable
    public JsonNode getRawValue() {
        return rawValue;
    }
}
