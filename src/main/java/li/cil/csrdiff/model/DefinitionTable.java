package li.cil.csrdiff.model;

import java.util.*;

/**
 * Register definitions indexed by their exact name.
 * <p>
 * Lookups prefer an exact match and fall back to a case-insensitive one. Adding a definition under a
 * name already present replaces the earlier definition.
 */
public final class DefinitionTable implements Iterable<RegisterDefinition> {
    private final LinkedHashMap<String, RegisterDefinition> byName = new LinkedHashMap<>();

    /**
     * Adds a definition, replacing any earlier definition with the same name.
     *
     * @param definition the definition to add.
     * @return the replaced definition, if any.
     */
    public Optional<RegisterDefinition> put(final RegisterDefinition definition) {
        return Optional.ofNullable(byName.put(definition.name, definition));
    }

    public Optional<RegisterDefinition> get(final String name) {
        final RegisterDefinition exact = byName.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }

        final String lowerName = name.toLowerCase(Locale.ROOT);
        for (final Map.Entry<String, RegisterDefinition> entry : byName.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).equals(lowerName)) {
                return Optional.of(entry.getValue());
            }
        }

        return Optional.empty();
    }

    /**
     * Looks up a definition by its exact, case-sensitive name.
     */
    public Optional<RegisterDefinition> getExact(final String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    @Override
    public Iterator<RegisterDefinition> iterator() {
        return Collections.unmodifiableCollection(byName.values()).iterator();
    }
}
