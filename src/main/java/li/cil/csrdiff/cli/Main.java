package li.cil.csrdiff.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import li.cil.csrdiff.CsrDiff;
import li.cil.csrdiff.decode.DecodeEngine;
import li.cil.csrdiff.decode.FieldChange;
import li.cil.csrdiff.decode.FieldDifference;
import li.cil.csrdiff.decode.FieldObservation;
import li.cil.csrdiff.model.Field;
import li.cil.csrdiff.model.RegisterDefinition;
import li.cil.csrdiff.schema.Diagnostic;
import li.cil.csrdiff.schema.LoadResult;
import li.cil.csrdiff.utils.BitUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command line front end: {@code csrdiff <decode|diff|compare|show|list> --spec <dir> [options]}.
 */
public final class Main {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_NOT_FOUND = 2;

    private static final int NAME_SAMPLE_SIZE = 50;

    private static final ObjectMapper JSON = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();

    private static final String USAGE = String.join(System.lineSeparator(),
        "usage: csrdiff <command> --spec <dir> [--config <file>] [--xlen <32|64>] [--json] [options]",
        "commands:",
        "  decode  --csr <name> --value <value>                 decode a CSR value into bitfields",
        "  diff    --csr <name> --xor <mask>                    list fields touched by an XOR mask",
        "  compare --csr <name> --value1 <value> --value2 <value> show fields that differ",
        "  show    --csr <name>                                 print a CSR definition and its fields",
        "  list                                                 list known CSR names",
        "values may be given as 0x hex, 0b binary, 0o octal or decimal.");

    private final PrintStream out;
    private final PrintStream err;

    public Main(final PrintStream out, final PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(final String[] args) {
        System.exit(new Main(System.out, System.err).run(args));
    }

    public int run(final String[] args) {
        final Arguments arguments;
        final Command command;
        final int xlen;
        try {
            arguments = Arguments.parse(args);
            if (arguments.has("--help") || arguments.getPositional().isEmpty()) {
                out.println(USAGE);
                return arguments.has("--help") ? EXIT_OK : EXIT_USAGE;
            }
            command = Command.parse(arguments.getPositional().get(0));
            xlen = parseXlen(arguments.get("--xlen").orElse("64"));
            arguments.require("--spec");
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        final Path schemaDirectory = Paths.get(arguments.require("--spec"));
        final Path config = arguments.get("--config").map(Paths::get).orElse(null);

        final LoadResult result;
        try {
            result = CsrDiff.load(schemaDirectory, config);
        } catch (final IOException e) {
            LOGGER.error("Failed loading CSR definitions from [{}].", schemaDirectory, e);
            err.printf("Failed loading CSR definitions from %s: %s%n", schemaDirectory, e.getMessage());
            return EXIT_USAGE;
        }

        if (command == Command.LIST) {
            return list(result, arguments.has("--json"));
        }

        final String name;
        try {
            name = arguments.require("--csr");
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        final Optional<RegisterDefinition> definition = result.table.get(name);
        if (definition.isEmpty()) {
            err.printf("CSR '%s' not found under %s. Available count: %d%n", name, schemaDirectory, result.table.size());
            final List<String> sample = new ArrayList<>(result.table.names());
            err.println("Some available CSRs: " + String.join(", ", sample.subList(0, Math.min(NAME_SAMPLE_SIZE, sample.size()))));
            return EXIT_NOT_FOUND;
        }

        try {
            switch (command) {
                case DECODE -> decode(definition.get(), ValueParser.parse(arguments.require("--value")), xlen, arguments.has("--json"));
                case DIFF -> diff(definition.get(), ValueParser.parse(arguments.require("--xor")), xlen, arguments.has("--json"));
                case COMPARE -> compare(definition.get(),
                    ValueParser.parse(arguments.require("--value1")),
                    ValueParser.parse(arguments.require("--value2")),
                    xlen, arguments.has("--json"));
                case SHOW -> show(definition.get(), arguments.has("--json"));
                default -> throw new IllegalStateException();
            }
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (final JsonProcessingException e) {
            LOGGER.error("Failed writing JSON output.", e);
            return EXIT_USAGE;
        }

        return EXIT_OK;
    }

    private int list(final LoadResult result, final boolean json) {
        if (json) {
            final ObjectNode root = JsonNodeFactory.instance.objectNode();
            final ArrayNode names = root.putArray("csrs");
            result.table.names().forEach(names::add);
            final ArrayNode diagnostics = root.putArray("diagnostics");
            for (final Diagnostic diagnostic : result.getDiagnostics()) {
                diagnostics.add(diagnostic.toString());
            }
            try {
                out.println(JSON.writeValueAsString(root));
            } catch (final JsonProcessingException e) {
                LOGGER.error("Failed writing JSON output.", e);
                return EXIT_USAGE;
            }
        } else {
            for (final String name : result.table.names()) {
                out.println(name);
            }
            out.printf("%d CSRs, %d diagnostics%n", result.table.size(), result.getDiagnostics().size());
        }
        return EXIT_OK;
    }

    private void show(final RegisterDefinition definition, final boolean json) throws JsonProcessingException {
        if (json) {
            out.println(JSON.writeValueAsString(definition.toJson()));
            return;
        }

        out.printf("CSR: %s (%s) length=%d priv_mode=%s writable=%s%n", definition.name,
            definition.longName, definition.length, definition.privMode, definition.writable);
        for (final Field field : definition.getFields()) {
            out.printf(" %-20s [%2d:%2d] mask=%18s access=%-11s %s%n",
                field.name, field.msb, field.lsb, BitUtils.toHex(field.mask()),
                field.getAccessType(), field.description);
        }
    }

    private void decode(final RegisterDefinition definition, final long value, final int xlen, final boolean json) throws JsonProcessingException {
        final List<FieldObservation> decoded = DecodeEngine.decodeValue(definition, value);
        if (json) {
            final ObjectNode root = JsonNodeFactory.instance.objectNode();
            root.put("csr", definition.name);
            root.put("value", BitUtils.toHex(value));
            final ArrayNode fields = root.putArray("decoded");
            for (final FieldObservation observation : decoded) {
                fields.add(toJson(observation));
            }
            out.println(JSON.writeValueAsString(root));
            return;
        }

        out.printf("CSR: %s = %s%n", definition.name, BitUtils.toPaddedHex(value, xlen));
        final StringBuilder sb = new StringBuilder();
        for (final FieldObservation observation : decoded) {
            sb.append(observation).append(", ");
        }
        out.println(sb);
    }

    private void diff(final RegisterDefinition definition, final long xor, final int xlen, final boolean json) throws JsonProcessingException {
        final List<FieldChange> changes = DecodeEngine.decodeXorMask(definition, xor);
        if (json) {
            final ObjectNode root = JsonNodeFactory.instance.objectNode();
            root.put("csr", definition.name);
            root.put("xor", BitUtils.toHex(xor));
            final ArrayNode entries = root.putArray("changes");
            for (final FieldChange change : changes) {
                final ObjectNode node = entries.addObject();
                node.put("name", change.name);
                node.put("msb", change.msb);
                node.put("lsb", change.lsb);
                node.put("width", change.width);
                node.put("changed_mask", BitUtils.toHex(change.changedMask));
                node.put("changed_rel", BitUtils.toHex(change.changedRelative));
                node.put("changed_bits_count", change.changedBitCount);
                node.put("desc", change.description);
            }
            out.println(JSON.writeValueAsString(root));
            return;
        }

        out.printf("CSR: %s xor %s (fields with changes)%n", definition.name, BitUtils.toPaddedHex(xor, xlen));
        for (final FieldChange change : changes) {
            out.printf(" %-20s [%2d:%2d] changed_mask=%10s rel=%6s bits_changed=%2d  %s%n",
                change.name, change.msb, change.lsb,
                BitUtils.toHex(change.changedMask), BitUtils.toHex(change.changedRelative),
                change.changedBitCount, change.description);
        }
    }

    private void compare(final RegisterDefinition definition, final long first, final long second, final int xlen, final boolean json) throws JsonProcessingException {
        final List<FieldDifference> differences = DecodeEngine.compare(definition, first, second);
        if (json) {
            final ObjectNode root = JsonNodeFactory.instance.objectNode();
            root.put("csr", definition.name);
            root.put("value1", BitUtils.toHex(first));
            root.put("value2", BitUtils.toHex(second));
            final ArrayNode entries = root.putArray("differences");
            for (final FieldDifference difference : differences) {
                final ObjectNode node = entries.addObject();
                node.put("field", difference.name());
                node.put("value1", unsigned(difference.first.value));
                node.put("value2", unsigned(difference.second.value));
            }
            out.println(JSON.writeValueAsString(root));
            return;
        }

        out.printf("CSR: %s %s vs %s (field differences)%n", definition.name,
            BitUtils.toPaddedHex(first, xlen), BitUtils.toPaddedHex(second, xlen));
        for (final FieldDifference difference : differences) {
            final FieldObservation a = difference.first;
            final FieldObservation b = difference.second;
            out.printf(" %-20s [%2d:%2d] = %6s / %3s / %10s vs %6s / %3s / %10s \"%s\"%n",
                a.name, a.msb, a.lsb,
                a.hex(), Long.toUnsignedString(a.value), a.binary(),
                b.hex(), Long.toUnsignedString(b.value), b.binary(),
                a.description);
        }
    }

    private static ObjectNode toJson(final FieldObservation observation) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("name", observation.name);
        node.put("msb", observation.msb);
        node.put("lsb", observation.lsb);
        node.put("width", observation.width);
        node.put("value", unsigned(observation.value));
        node.put("hex", observation.hex());
        node.put("bin", observation.binary());
        node.put("desc", observation.description);
        return node;
    }

    private static BigInteger unsigned(final long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }

    private static int parseXlen(final String text) {
        final String value = StringUtils.strip(text);
        if ("32".equals(value)) {
            return 32;
        }
        if ("64".equals(value)) {
            return 64;
        }
        throw new IllegalArgumentException(String.format("Invalid XLEN [%s], expected 32 or 64.", text));
    }

    enum Command {
        DECODE,
        DIFF,
        COMPARE,
        SHOW,
        LIST,
        ;

        static Command parse(final String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (final IllegalArgumentException e) {
                throw new IllegalArgumentException(String.format("Unknown command [%s].", name));
            }
        }
    }
}
