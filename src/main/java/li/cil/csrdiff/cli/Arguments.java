package li.cil.csrdiff.cli;

import java.util.*;

/**
 * Minimal {@code --option value} / {@code --flag} command line parser.
 */
public final class Arguments {
    private static final Set<String> FLAGS = Set.of("--json", "--help");
    private static final Set<String> OPTIONS = Set.of(
        "--spec", "--config", "--xlen", "--csr", "--value", "--xor", "--value1", "--value2");

    private final Map<String, String> values = new HashMap<>();
    private final Set<String> flags = new HashSet<>();
    private final List<String> positional = new ArrayList<>();

    public static Arguments parse(final String[] args) {
        final Arguments result = new Arguments();
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if (FLAGS.contains(arg)) {
                result.flags.add(arg);
            } else if (OPTIONS.contains(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(String.format("Missing value for option [%s].", arg));
                }
                result.values.put(arg, args[++i]);
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException(String.format("Unknown option [%s].", arg));
            } else {
                result.positional.add(arg);
            }
        }
        return result;
    }

    public boolean has(final String flag) {
        return flags.contains(flag) || values.containsKey(flag);
    }

    public Optional<String> get(final String option) {
        return Optional.ofNullable(values.get(option));
    }

    public String require(final String option) {
        final String value = values.get(option);
        if (value == null) {
            throw new IllegalArgumentException(String.format("Missing required option [%s].", option));
        }
        return value;
    }

    public List<String> getPositional() {
        return Collections.unmodifiableList(positional);
    }
}
