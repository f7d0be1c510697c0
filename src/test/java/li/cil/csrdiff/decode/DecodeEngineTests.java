package li.cil.csrdiff.decode;

import li.cil.csrdiff.model.Field;
import li.cil.csrdiff.model.RegisterDefinition;
import li.cil.csrdiff.range.BitRange;
import li.cil.csrdiff.schema.SchemaLoader;
import li.cil.csrdiff.schema.SchemaLoaderTests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public final class DecodeEngineTests {
    private RegisterDefinition demo;

    @BeforeEach
    public void setupEach() {
        // Declared out of bit order on purpose.
        demo = new RegisterDefinition("demo");
        demo.addField(new Field("CNT", BitRange.of(4, 0)));
        demo.addField(new Field("EN", BitRange.single(7)));
        demo.addField(new Field("MODE", BitRange.of(6, 5)));
    }

    private static List<String> names(final List<?> entries) {
        final List<String> result = new ArrayList<>();
        for (final Object entry : entries) {
            if (entry instanceof FieldObservation) {
                result.add(((FieldObservation) entry).name);
            } else if (entry instanceof FieldChange) {
                result.add(((FieldChange) entry).name);
            } else {
                result.add(((FieldDifference) entry).name());
            }
        }
        return result;
    }

    @Test
    public void decodeValueExtractsEachField() {
        final List<FieldObservation> decoded = DecodeEngine.decodeValue(demo, 0b10110101);

        assertEquals(List.of("EN", "MODE", "CNT"), names(decoded));
        assertEquals(1, decoded.get(0).value);
        assertEquals(1, decoded.get(1).value);
        assertEquals(21, decoded.get(2).value);

        final FieldObservation cnt = decoded.get(2);
        assertEquals(4, cnt.msb);
        assertEquals(0, cnt.lsb);
        assertEquals(5, cnt.width);
        assertEquals("0x15", cnt.hex());
        assertEquals("0b10101", cnt.binary());
        assertEquals("MODE[6:5]=0b1", decoded.get(1).toString());
        assertEquals("EN[7]=0b1", decoded.get(0).toString());
    }

    @Test
    public void decodeXorMaskReportsTouchedFields() {
        final List<FieldChange> changes = DecodeEngine.decodeXorMask(demo, 0b00100000);

        assertEquals(1, changes.size());
        final FieldChange mode = changes.get(0);
        assertEquals("MODE", mode.name);
        assertEquals(0x20L, mode.changedMask);
        assertEquals(0x1L, mode.changedRelative);
        assertEquals(1, mode.changedBitCount);
    }

    @Test
    public void compareReportsDifferingFields() {
        final List<FieldDifference> differences = DecodeEngine.compare(demo, 0b10110101, 0b10100101);

        assertEquals(1, differences.size());
        assertEquals("CNT", differences.get(0).name());
        assertEquals(21, differences.get(0).first.value);
        assertEquals(5, differences.get(0).second.value);
    }

    @Test
    public void compareOfEqualValuesIsEmpty() {
        assertTrue(DecodeEngine.compare(demo, 0xA5, 0xA5).isEmpty());
        assertTrue(DecodeEngine.decodeXorMask(demo, 0).isEmpty());
    }

    @Test
    public void decodingIsDeterministicAndLeavesDefinitionUntouched() {
        final List<FieldObservation> first = DecodeEngine.decodeValue(demo, 0xDEADBEEFL);
        final List<FieldObservation> second = DecodeEngine.decodeValue(demo, 0xDEADBEEFL);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).toString(), second.get(i).toString());
            assertEquals(first.get(i).value, second.get(i).value);
        }

        final List<String> declared = new ArrayList<>();
        for (final Field field : demo.getFields()) {
            declared.add(field.name);
        }
        assertEquals(List.of("CNT", "EN", "MODE"), declared);
    }

    @Test
    public void xorChangesetMatchesComparisonForDisjointFields() {
        final Random random = new Random(0xdeadbeef);
        for (int i = 0; i < 200; i++) {
            final long a = random.nextLong() & 0xFF;
            final long b = random.nextLong() & 0xFF;

            final Set<String> changed = new HashSet<>(names(DecodeEngine.decodeXorMask(demo, a ^ b)));
            final Set<String> different = new HashSet<>(names(DecodeEngine.compare(demo, a, b)));

            assertEquals(different, changed, String.format("%02x vs %02x", a, b));
        }
    }

    @Test
    public void tilingFieldsReconstructValue() {
        final RegisterDefinition tiled = new RegisterDefinition("tiled");
        tiled.addField(new Field("HI", BitRange.of(63, 40)));
        tiled.addField(new Field("MID", BitRange.of(39, 8)));
        tiled.addField(new Field("LO", BitRange.of(7, 0)));

        final Random random = new Random(0xdeadbeef);
        for (int i = 0; i < 100; i++) {
            final long value = random.nextLong();
            long reconstructed = 0;
            for (final FieldObservation observation : DecodeEngine.decodeValue(tiled, value)) {
                reconstructed += observation.value << observation.lsb;
            }
            assertEquals(value, reconstructed);
        }
    }

    @Test
    public void fieldsWithSameMsbKeepDeclarationOrder() {
        final RegisterDefinition overlapping = new RegisterDefinition("overlapping");
        overlapping.addField(new Field("WIDE", BitRange.of(7, 0)));
        overlapping.addField(new Field("NARROW", BitRange.of(7, 4)));
        overlapping.addField(new Field("TOP", BitRange.of(15, 8)));

        assertEquals(List.of("TOP", "WIDE", "NARROW"), names(DecodeEngine.decodeValue(overlapping, 0)));
    }

    @Test
    public void fullWidthFieldsAreUnsigned() {
        final RegisterDefinition wide = new RegisterDefinition("wide");
        wide.addField(new Field("ALL", BitRange.of(63, 0)));
        wide.addField(new Field("SD", BitRange.single(63)));

        final List<FieldObservation> decoded = DecodeEngine.decodeValue(wide, -1L);
        assertEquals(-1L, decoded.get(0).value);
        assertEquals("0xffffffffffffffff", decoded.get(0).hex());
        assertEquals(1L, decoded.get(1).value);

        final List<FieldChange> changes = DecodeEngine.decodeXorMask(wide, 0x8000000000000001L);
        assertEquals(2, changes.get(0).changedBitCount);
        assertEquals(1L, changes.get(1).changedRelative);
    }

    @Test
    public void mstatusMismatchBetweenReferenceAndDevice() throws Exception {
        final RegisterDefinition mstatus = new SchemaLoader().load(SchemaLoaderTests.fixtures()).table.get("mstatus").orElseThrow();
        final long ref = 0x0000000a00002000L;
        final long dut = 0x8000000a00006000L;

        final List<FieldDifference> differences = DecodeEngine.compare(mstatus, ref, dut);
        assertEquals(List.of("SD", "FS"), names(differences));
        assertEquals(0, differences.get(0).first.value);
        assertEquals(1, differences.get(0).second.value);
        assertEquals(1, differences.get(1).first.value);
        assertEquals(3, differences.get(1).second.value);

        final List<FieldChange> changes = DecodeEngine.decodeXorMask(mstatus, ref ^ dut);
        assertEquals(List.of("SD", "FS"), names(changes));
        assertEquals(0x8000000000000000L, changes.get(0).changedMask);
        assertEquals(0x4000L, changes.get(1).changedMask);
        assertEquals(0x2L, changes.get(1).changedRelative);

        final List<FieldObservation> decoded = DecodeEngine.decodeValue(mstatus, ref);
        assertEquals("SXL", decoded.get(1).name);
        assertEquals(2, decoded.get(1).value);
        assertEquals(2, decoded.get(2).value);
    }
}
