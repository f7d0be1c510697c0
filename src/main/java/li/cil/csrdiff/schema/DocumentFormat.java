package li.cil.csrdiff.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The serialization formats definition documents may be written in, selected by file extension.
 */
public enum DocumentFormat {
    YAML(new YAMLMapper(), "yml", "yaml"),
    JSON(new JsonMapper(), "json"),
    ;

    private final ObjectMapper mapper;
    private final String[] extensions;

    DocumentFormat(final ObjectMapper mapper, final String... extensions) {
        this.mapper = mapper;
        this.extensions = extensions;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public static Optional<DocumentFormat> forPath(final Path path) {
        final String fileName = path.getFileName().toString();
        for (final DocumentFormat format : values()) {
            if (FilenameUtils.isExtension(fileName, format.extensions)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
