package li.cil.csrdiff.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import li.cil.csrdiff.model.DefinitionTable;
import li.cil.csrdiff.model.Field;
import li.cil.csrdiff.model.RegisterDefinition;
import li.cil.csrdiff.range.BitRange;
import li.cil.csrdiff.schema.Diagnostic;
import li.cil.csrdiff.schema.DocumentReader;
import li.cil.csrdiff.schema.MapperDocumentReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Adds access types and legal values from a per-hart configuration document to loaded definitions.
 * <p>
 * The document is keyed by hart; only the first hart entry is used. Each hart entry maps register
 * names to objects with {@code rv64} and/or {@code rv32} sub-objects, which may carry a whole-register
 * {@code type} descriptor and a {@code fields} list or mapping with per-field {@code type} descriptors.
 * <p>
 * Enrichment is additive: a field whose access type is already set is never changed, so applying the
 * same or another document again leaves earlier assignments intact. Field-specific descriptors are
 * applied before the whole-register descriptor fills in the remaining fields.
 */
public final class ConfigEnricher {
    private static final Logger LOGGER = LogManager.getLogger();

    static final String HART_PREFIX = "hart";
    static final String HART_IDS_KEY = "hart_ids";
    static final String[] PROFILE_KEYS = {"rv64", "rv32"};
    static final String TYPE_KEY = "type";
    static final String FIELDS_KEY = "fields";
    static final String NAME_KEY = "name";

    private final DocumentReader reader;

    public ConfigEnricher() {
        this(new MapperDocumentReader());
    }

    public ConfigEnricher(final DocumentReader reader) {
        this.reader = reader;
    }

    /**
     * Enriches the table from the specified source, logging problems with the source.
     *
     * @param table  the table to update in place.
     * @param source the configuration document. Nothing happens when {@code null} or missing.
     */
    public void enrich(final DefinitionTable table, @Nullable final Path source) {
        enrich(table, source, diagnostic -> {
        });
    }

    /**
     * Enriches the table from the specified source.
     *
     * @param table       the table to update in place.
     * @param source      the configuration document. Nothing happens when {@code null} or missing.
     * @param diagnostics receives a diagnostic if the source exists but cannot be read.
     */
    public void enrich(final DefinitionTable table, @Nullable final Path source, final Consumer<Diagnostic> diagnostics) {
        if (source == null || !Files.exists(source)) {
            return;
        }

        final JsonNode document;
        try {
            document = reader.read(source);
        } catch (final IOException | RuntimeException e) {
            final Diagnostic diagnostic = Diagnostic.forFile(Diagnostic.Kind.ENRICHMENT_SOURCE_UNAVAILABLE, source,
                String.format("Failed reading configuration: %s", e.getMessage()), e);
            LOGGER.warn("{}", diagnostic);
            diagnostics.accept(diagnostic);
            return;
        }

        final Optional<JsonNode> hart = selectHart(document);
        if (hart.isEmpty()) {
            LOGGER.debug("No hart entry in [{}].", source);
            return;
        }

        enrichFromHart(table, hart.get());
    }

    /**
     * Enriches the table from a single hart entry.
     *
     * @param table the table to update in place.
     * @param hart  mapping from register name to register configuration.
     */
    public static void enrichFromHart(final DefinitionTable table, final JsonNode hart) {
        final Iterator<Map.Entry<String, JsonNode>> it = hart.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> entry = it.next();
            final Optional<RegisterDefinition> definition = table.get(entry.getKey());
            if (definition.isEmpty()) {
                continue;
            }

            final JsonNode profile = selectProfile(entry.getValue());
            if (profile == null) {
                continue;
            }

            enrichRegister(definition.get(), profile);
        }
    }

    static Optional<JsonNode> selectHart(final JsonNode document) {
        if (!document.isObject()) {
            return Optional.empty();
        }

        final Iterator<Map.Entry<String, JsonNode>> it = document.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getKey().startsWith(HART_PREFIX) && !HART_IDS_KEY.equals(entry.getKey()) && entry.getValue().isObject()) {
                return Optional.of(entry.getValue());
            }
        }

        return Optional.empty();
    }

    @Nullable
    static JsonNode selectProfile(final JsonNode registerConfig) {
        for (final String key : PROFILE_KEYS) {
            final JsonNode profile = registerConfig.get(key);
            if (profile != null && profile.isObject()) {
                return profile;
            }
        }
        return null;
    }

    private static void enrichRegister(final RegisterDefinition definition, final JsonNode profile) {
        final JsonNode typeDescriptor = profile.get(TYPE_KEY);
        final Classification registerType = typeDescriptor != null && typeDescriptor.isObject()
            ? AccessTypeClassifier.classify(typeDescriptor)
            : null;

        if (registerType != null && definition.getFields().isEmpty()) {
            final int msb = profile.path("msb").asInt(definition.length - 1);
            final int lsb = profile.path("lsb").asInt(0);
            final BitRange range;
            try {
                range = BitRange.of(msb, lsb);
            } catch (final IllegalArgumentException e) {
                LOGGER.warn("Cannot synthesize field for [{}]: {}", definition, e.getMessage());
                return;
            }
            final Field field = new Field(definition.name, range);
            field.setAccessTypeIfAbsent(registerType.accessType, registerType.legalValues);
            definition.addField(field);
            LOGGER.debug("Synthesized field [{}] of [{}] as [{}].", field, definition, registerType);
            return;
        }

        enrichFields(definition, profile.get(FIELDS_KEY), profile);

        if (registerType != null) {
            for (final Field field : definition.getFields()) {
                assign(definition, field, registerType);
            }
        }
    }

    private static void enrichFields(final RegisterDefinition definition, @Nullable final JsonNode fields, final JsonNode profile) {
        if (fields == null) {
            return;
        }

        if (fields.isArray()) {
            for (final JsonNode element : fields) {
                if (element.isTextual()) {
                    enrichField(definition, element.asText(), profile.get(element.asText()));
                } else if (element.isObject() && element.hasNonNull(NAME_KEY)) {
                    enrichField(definition, element.get(NAME_KEY).asText(), element);
                }
            }
        } else if (fields.isObject()) {
            final Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                final Map.Entry<String, JsonNode> entry = it.next();
                enrichField(definition, entry.getKey(), entry.getValue());
            }
        }
    }

    private static void enrichField(final RegisterDefinition definition, final String name, @Nullable final JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return;
        }

        final JsonNode typeDescriptor = entry.get(TYPE_KEY);
        if (typeDescriptor == null || !typeDescriptor.isObject()) {
            return;
        }

        final Classification classification = AccessTypeClassifier.classify(typeDescriptor);
        for (final Field field : definition.getFields()) {
            if (field.name.equalsIgnoreCase(name)) {
                assign(definition, field, classification);
            }
        }
    }

    private static void assign(final RegisterDefinition definition, final Field field, final Classification classification) {
        if (field.setAccessTypeIfAbsent(classification.accessType, classification.legalValues)) {
            LOGGER.debug("Set [{}.{}] to [{}].", definition, field.name, classification);
        }
    }
}
