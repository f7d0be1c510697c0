package li.cil.csrdiff.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import li.cil.csrdiff.model.AccessType;

import javax.annotation.Nullable;

public final class AccessTypeClassifier {
    /**
     * Descriptor keys in the order they are checked. A descriptor is expected to carry at most one.
     */
    private static final AccessType[] CHECK_ORDER = {
        AccessType.WARL,
        AccessType.WLRL,
        AccessType.WPRI,
        AccessType.WIRI,
        AccessType.RO_CONSTANT,
        AccessType.RO_VARIABLE,
    };

    private static final String WARL_LEGAL_KEY = "legal";

    /**
     * Classifies a type descriptor such as {@code {warl: {legal: [0, 1]}}} or {@code {ro_constant: 0}}.
     * <p>
     * The payload of {@code warl} is the value under its {@code legal} key, if any. {@code wlrl},
     * {@code ro_constant} and {@code ro_variable} carry their raw value. {@code wpri} and {@code wiri}
     * carry nothing.
     *
     * @param descriptor the type descriptor.
     * @return the classification; {@link Classification#UNSET} if the descriptor names no known type.
     */
    public static Classification classify(@Nullable final JsonNode descriptor) {
        if (descriptor == null || !descriptor.isObject()) {
            return Classification.UNSET;
        }

        for (final AccessType type : CHECK_ORDER) {
            final String key = type.getKey();
            if (key == null || !descriptor.has(key)) {
                continue;
            }

            final JsonNode value = descriptor.get(key);
            switch (type) {
                case WARL:
                    return new Classification(type, value.isObject() ? value.get(WARL_LEGAL_KEY) : null);
                case WPRI:
                case WIRI:
                    return new Classification(type, null);
                default:
                    return new Classification(type, value.isNull() ? null : value);
            }
        }

        return Classification.UNSET;
    }

    private AccessTypeClassifier() {
    }
}
