package li.cil.csrdiff.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads documents with the mapper of the {@link DocumentFormat} matching the file extension, falling
 * back to YAML, a superset of JSON, for unknown extensions.
 */
public final class MapperDocumentReader implements DocumentReader {
    @Override
    public JsonNode read(final Path path) throws IOException {
        final DocumentFormat format = DocumentFormat.forPath(path).orElse(DocumentFormat.YAML);
        try (final InputStream stream = Files.newInputStream(path)) {
            final JsonNode root = format.getMapper().readTree(stream);
            return root != null ? root : MissingNode.getInstance();
        }
    }
}
