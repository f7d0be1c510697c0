package li.cil.csrdiff.decode;

/**
 * A field whose value differs between two register values.
 */
public final class FieldDifference {
    public final FieldObservation first;
    public final FieldObservation second;

    FieldDifference(final FieldObservation first, final FieldObservation second) {
        this.first = first;
        this.second = second;
    }

    public String name() {
        return first.name;
    }

    @Override
    public String toString() {
        return String.format("%s: %s vs %s", first.name, first.binary(), second.binary());
    }
}
