package li.cil.csrdiff.schema;

import com.fasterxml.jackson.databind.JsonNode;
import li.cil.csrdiff.model.DefinitionTable;
import li.cil.csrdiff.model.Field;
import li.cil.csrdiff.model.RegisterDefinition;
import li.cil.csrdiff.range.RangeResolution;
import li.cil.csrdiff.range.RangeSpecNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link DefinitionTable} from a directory of register documents, one register per file.
 * <p>
 * A document is taken as a register if it is a mapping with {@code kind: csr} and a {@code name}.
 * Other documents are skipped without a diagnostic. Documents that fail to parse and fields whose
 * location cannot be resolved are skipped and reported through {@link LoadResult#getDiagnostics()}.
 */
public final class SchemaLoader {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final String REGISTER_KIND = "csr";

    /**
     * Keys checked for a field location, in order. The first one present is used.
     */
    static final String[] LOCATION_KEYS = {"location", "location_rv64", "location_rv32"};

    private final DocumentReader reader;

    public SchemaLoader() {
        this(new MapperDocumentReader());
    }

    public SchemaLoader(final DocumentReader reader) {
        this.reader = reader;
    }

    /**
     * Loads all register documents found directly inside the specified directory.
     * <p>
     * Files are visited in path order, so when two documents declare the same register name the one
     * in the later file wins.
     *
     * @param directory the directory to scan. Subdirectories are not visited.
     * @return the loaded definitions and the diagnostics for everything that was skipped.
     * @throws IOException if the directory itself cannot be listed.
     */
    public LoadResult load(final Path directory) throws IOException {
        final ArrayList<Path> files;
        try (final Stream<Path> stream = Files.list(directory)) {
            files = stream
                .filter(Files::isRegularFile)
                .filter(path -> DocumentFormat.forPath(path).isPresent())
                .sorted()
                .collect(Collectors.toCollection(ArrayList::new));
        }

        final DefinitionTable table = new DefinitionTable();
        final ArrayList<Diagnostic> diagnostics = new ArrayList<>();
        for (final Path file : files) {
            loadFile(file, table, diagnostics);
        }

        LOGGER.info("Loaded {} CSR definitions from {} files.", table.size(), files.size());

        return new LoadResult(table, diagnostics);
    }

    private void loadFile(final Path file, final DefinitionTable table, final ArrayList<Diagnostic> diagnostics) {
        final JsonNode document;
        try {
            document = reader.read(file);
        } catch (final IOException | RuntimeException e) {
            report(diagnostics, Diagnostic.forFile(Diagnostic.Kind.UNREADABLE_DOCUMENT, file,
                String.format("Failed parsing document: %s", e.getMessage()), e));
            return;
        }

        if (!isRegisterDocument(document)) {
            LOGGER.debug("Skipping [{}], not a register document.", file);
            return;
        }

        final RegisterDefinition definition = parseDefinition(file, document, diagnostics);
        table.put(definition);
    }

    static boolean isRegisterDocument(@Nullable final JsonNode document) {
        return document != null &&
               document.isObject() &&
               REGISTER_KIND.equals(document.path("kind").asText(null)) &&
               document.hasNonNull("name");
    }

    private static RegisterDefinition parseDefinition(final Path file, final JsonNode document, final ArrayList<Diagnostic> diagnostics) {
        final String name = document.get("name").asText();
        final RegisterDefinition definition = new RegisterDefinition(name, document);

        final JsonNode fields = document.path("fields");
        if (!fields.isObject()) {
            return definition;
        }

        final Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> entry = it.next();
            final Field field = parseField(file, name, entry.getKey(), entry.getValue(), diagnostics);
            if (field != null) {
                definition.addField(field);
            }
        }

        return definition;
    }

    @Nullable
    private static Field parseField(final Path file, final String register, final String name, final JsonNode descriptor, final ArrayList<Diagnostic> diagnostics) {
        if (!descriptor.isObject()) {
            report(diagnostics, Diagnostic.forField(Diagnostic.Kind.MALFORMED_FIELD, file, register, name,
                "Field descriptor is not a mapping."));
            return null;
        }

        final JsonNode location = findLocation(descriptor);
        if (location == null) {
            report(diagnostics, Diagnostic.forField(Diagnostic.Kind.MISSING_LOCATION, file, register, name,
                "Field has no location."));
            return null;
        }

        final RangeResolution resolution = RangeSpecNormalizer.tryNormalize(location);
        if (!resolution.isSuccess()) {
            report(diagnostics, Diagnostic.forField(Diagnostic.Kind.MALFORMED_RANGE_SPEC, file, register, name,
                String.format("Unrecognized bit range [%s]: %s", location, resolution.getReason())));
            return null;
        }

        return new Field(name,
            resolution.getRange(),
            textOrNull(descriptor.get("description")),
            textOrNull(descriptor.get("type")),
            descriptor.get("reset_value"),
            textOrNull(descriptor.get("alias")));
    }

    @Nullable
    static JsonNode findLocation(final JsonNode descriptor) {
        for (final String key : LOCATION_KEYS) {
            final JsonNode location = descriptor.get(key);
            if (location != null && !location.isNull()) {
                return location;
            }
        }
        return null;
    }

    @Nullable
    private static String textOrNull(@Nullable final JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static void report(final ArrayList<Diagnostic> diagnostics, final Diagnostic diagnostic) {
        LOGGER.warn("{}", diagnostic);
        diagnostics.add(diagnostic);
    }
}
