package li.cil.csrdiff.schema;

import li.cil.csrdiff.model.DefinitionTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class LoadResult {
    public final DefinitionTable table;
    private final ArrayList<Diagnostic> diagnostics;

    public LoadResult(final DefinitionTable table, final List<Diagnostic> diagnostics) {
        this.table = table;
        this.diagnostics = new ArrayList<>(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getDiagnostics(final Diagnostic.Kind kind) {
        final ArrayList<Diagnostic> result = new ArrayList<>();
        for (final Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind == kind) {
                result.add(diagnostic);
            }
        }
        return result;
    }

    public LoadResult withDiagnostics(final List<Diagnostic> additional) {
        final ArrayList<Diagnostic> merged = new ArrayList<>(diagnostics);
        merged.addAll(additional);
        return new LoadResult(table, merged);
    }
}
