package li.cil.csrdiff.schema;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Describes a file or field that was skipped while building or enriching a definition table.
 */
public final class Diagnostic {
    public enum Kind {
        /**
         * A file could not be read or parsed in its serialization format.
         */
        UNREADABLE_DOCUMENT,
        /**
         * A field location matched none of the recognized range encodings.
         */
        MALFORMED_RANGE_SPEC,
        /**
         * A field carried none of the location keys.
         */
        MISSING_LOCATION,
        /**
         * A field descriptor was not a mapping.
         */
        MALFORMED_FIELD,
        /**
         * The enrichment source exists but could not be read.
         */
        ENRICHMENT_SOURCE_UNAVAILABLE,
    }

    public final Kind kind;
    public final Path source;
    @Nullable public final String register;
    @Nullable public final String field;
    public final String message;
    @Nullable public final Throwable cause;

    public Diagnostic(final Kind kind,
                      final Path source,
                      @Nullable final String register,
                      @Nullable final String field,
                      final String message,
                      @Nullable final Throwable cause) {
        this.kind = kind;
        this.source = source;
        this.register = register;
        this.field = field;
        this.message = message;
        this.cause = cause;
    }

    public static Diagnostic forFile(final Kind kind, final Path source, final String message, @Nullable final Throwable cause) {
        return new Diagnostic(kind, source, null, null, message, cause);
    }

    public static Diagnostic forField(final Kind kind, final Path source, final String register, final String field, final String message) {
        return new Diagnostic(kind, source, register, field, message, null);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Diagnostic that = (Diagnostic) o;
        return kind == that.kind &&
               source.equals(that.source) &&
               Objects.equals(register, that.register) &&
               Objects.equals(field, that.field) &&
               message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, source, register, field, message);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(kind).append(' ').append(source);
        if (register != null) {
            sb.append(" [").append(register);
            if (field != null) {
                sb.append('.').append(field);
            }
            sb.append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}
