package li.cil.csrdiff.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import li.cil.csrdiff.model.AccessType;
import li.cil.csrdiff.schema.DocumentFormat;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public final class AccessTypeClassifierTests {
    private static JsonNode yaml(final String text) throws IOException {
        return DocumentFormat.YAML.getMapper().readTree(text);
    }

    @Test
    public void warlPayloadIsNestedUnderLegal() throws IOException {
        final Classification classification = AccessTypeClassifier.classify(yaml("{warl: {legal: [0, 1, 3]}}"));
        assertEquals(AccessType.WARL, classification.accessType);
        assertEquals(yaml("[0, 1, 3]"), classification.legalValues);
    }

    @Test
    public void warlWithoutLegalHasNoPayload() throws IOException {
        final Classification classification = AccessTypeClassifier.classify(yaml("{warl: {}}"));
        assertEquals(AccessType.WARL, classification.accessType);
        assertNull(classification.legalValues);
    }

    @Test
    public void rawPayloadTypes() throws IOException {
        assertEquals(new Classification(AccessType.WLRL, yaml("[0, 1]")), AccessTypeClassifier.classify(yaml("{wlrl: [0, 1]}")));
        assertEquals(new Classification(AccessType.RO_CONSTANT, yaml("5")), AccessTypeClassifier.classify(yaml("{ro_constant: 5}")));
        assertEquals(new Classification(AccessType.RO_VARIABLE, yaml("true")), AccessTypeClassifier.classify(yaml("{ro_variable: true}")));
    }

    @Test
    public void reservedTypesCarryNoPayload() throws IOException {
        assertEquals(new Classification(AccessType.WPRI, null), AccessTypeClassifier.classify(yaml("{wpri: {some: thing}}")));
        assertEquals(new Classification(AccessType.WIRI, null), AccessTypeClassifier.classify(yaml("{wiri: 1}")));
    }

    @Test
    public void unknownDescriptorsAreUnset() throws IOException {
        assertSame(Classification.UNSET, AccessTypeClassifier.classify(yaml("{rw: 1}")));
        assertSame(Classification.UNSET, AccessTypeClassifier.classify(yaml("warl")));
        assertSame(Classification.UNSET, AccessTypeClassifier.classify(null));
        assertFalse(Classification.UNSET.isSet());
    }

    @Test
    public void everyDescriptorKeyClassifiesToItsType() throws IOException {
        for (final AccessType type : AccessType.values()) {
            if (type == AccessType.UNSET) {
                assertNull(type.getKey());
                continue;
            }
            assertEquals(type, AccessTypeClassifier.classify(yaml("{" + type.getKey() + ": 1}")).accessType, type.name());
            assertEquals(type.getKey(), type.toString());
        }
    }
}
