package li.cil.csrdiff.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One named control/status register and its fields, in schema order.
 */
public final class RegisterDefinition {
    public static final int DEFAULT_LENGTH = 64;

    public final String name;
    public final String longName;
    public final int length;
    public final String description;
    public final boolean writable;
    public final String privMode;
    public final JsonNode definedBy;

    private final JsonNode raw;
    private final ArrayList<Field> fields = new ArrayList<>();

    public RegisterDefinition(final String name, final JsonNode raw) {
        this.name = name;
        this.raw = raw;
        this.longName = raw.path("long_name").asText("");
        this.length = raw.path("length").asInt(DEFAULT_LENGTH);
        this.description = raw.path("description").asText("");
        this.writable = raw.path("writable").asBoolean(false);
        this.privMode = raw.path("priv_mode").asText("");
        this.definedBy = raw.has("definedBy") ? raw.get("definedBy") : JsonNodeFactory.instance.objectNode();
    }

    public RegisterDefinition(final String name) {
        this(name, MissingNode.getInstance());
    }

    public void addField(final Field field) {
        fields.add(field);
    }

    /**
     * The fields of this register in the order they were declared.
     *
     * @return an unmodifiable view of the fields.
     */
    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * The document this definition was built from.
     */
    public JsonNode getRaw() {
        return raw;
    }

    public ObjectNode toJson() {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("name", name);
        node.put("long_name", longName);
        node.put("length", length);
        node.put("description", description);
        node.put("writable", writable);
        node.put("priv_mode", privMode);
        node.set("definedBy", definedBy);
        final ArrayNode fieldsNode = node.putArray("fields");
        for (final Field field : fields) {
            fieldsNode.add(field.toJson());
        }
        if (!raw.isMissingNode()) {
            node.set("raw", raw);
        }
        return node;
    }

    @Override
    public String toString() {
        return name;
    }
}
