package li.cil.csrdiff;

import li.cil.csrdiff.enrich.ConfigEnricher;
import li.cil.csrdiff.schema.Diagnostic;
import li.cil.csrdiff.schema.LoadResult;
import li.cil.csrdiff.schema.SchemaLoader;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Entry point for building a definition table.
 * <p>
 * Loading and enrichment run one after the other. Once this returns, the table is not modified again
 * and may be shared freely between decode calls.
 */
public final class CsrDiff {
    /**
     * Loads register definitions and optionally enriches them with a per-hart configuration.
     *
     * @param csrDirectory the directory containing one document per register.
     * @param configPath   the optional configuration document adding access types.
     * @return the definition table and the diagnostics of both passes.
     * @throws IOException if the register directory cannot be listed.
     */
    public static LoadResult load(final Path csrDirectory, @Nullable final Path configPath) throws IOException {
        final LoadResult result = new SchemaLoader().load(csrDirectory);

        final ArrayList<Diagnostic> enrichmentDiagnostics = new ArrayList<>();
        new ConfigEnricher().enrich(result.table, configPath, enrichmentDiagnostics::add);

        return result.withDiagnostics(enrichmentDiagnostics);
    }

    private CsrDiff() {
    }
}
