package li.cil.csrdiff.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;

public interface DocumentReader {
    /**
     * Parses the document at the specified path into a tree.
     *
     * @param path the file to read.
     * @return the root of the parsed document. May be a missing or null node for empty documents.
     * @throws IOException if the file cannot be read or is not valid in its format.
     */
    JsonNode read(Path path) throws IOException;
}
