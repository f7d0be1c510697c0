package li.cil.csrdiff.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import li.cil.csrdiff.range.BitRange;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public final class RegisterDefinitionTests {
    private static final YAMLMapper MAPPER = new YAMLMapper();

    @Test
    public void attributesDefaultWhenAbsent() {
        final RegisterDefinition definition = new RegisterDefinition("demo");

        assertEquals(RegisterDefinition.DEFAULT_LENGTH, definition.length);
        assertEquals("", definition.longName);
        assertFalse(definition.writable);
        assertTrue(definition.definedBy.isObject());
        assertTrue(definition.getFields().isEmpty());
    }

    @Test
    public void toJsonListsFieldsInDeclarationOrder() throws IOException {
        final JsonNode raw = MAPPER.readTree("{kind: csr, name: demo, length: 32, definedBy: Sm, priv_mode: M}");
        final RegisterDefinition definition = new RegisterDefinition("demo", raw);
        definition.addField(new Field("EN", BitRange.single(0)));
        definition.addField(new Field("CNT", BitRange.of(15, 8)));

        final ObjectNode json = definition.toJson();

        assertEquals(32, json.get("length").asInt());
        assertEquals("M", json.get("priv_mode").asText());
        assertEquals("Sm", json.get("definedBy").asText());
        assertSame(raw, json.get("raw"));
        assertEquals(2, json.get("fields").size());
        assertEquals("EN", json.get("fields").get(0).get("name").asText());
        assertEquals("0x1", json.get("fields").get(0).get("mask").asText());
        assertEquals("0xff00", json.get("fields").get(1).get("mask").asText());
    }

    @Test
    public void toJsonOmitsRawWithoutSourceDocument() {
        assertFalse(new RegisterDefinition("demo").toJson().has("raw"));
    }

    @Test
    public void fieldsViewIsUnmodifiable() {
        final RegisterDefinition definition = new RegisterDefinition("demo");
        assertThrows(UnsupportedOperationException.class, () -> definition.getFields().add(new Field("X", BitRange.single(1))));
    }
}
