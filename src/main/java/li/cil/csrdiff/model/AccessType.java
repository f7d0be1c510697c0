package li.cil.csrdiff.model;

import javax.annotation.Nullable;
import java.util.Locale;

public enum AccessType {
    UNSET(null),
    WARL("warl"),
    WLRL("wlrl"),
    WPRI("wpri"),
    WIRI("wiri"),
    RO_CONSTANT("ro_constant"),
    RO_VARIABLE("ro_variable"),
    ;

    @Nullable private final String key;

    AccessType(@Nullable final String key) {
        this.key = key;
    }

    /**
     * The key identifying this access type in a type descriptor, e.g. {@code warl}.
     *
     * @return the descriptor key, or {@code null} for {@link #UNSET}.
     */
    @Nullable
    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key != null ? key : name().toLowerCase(Locale.ROOT);
    }
}
