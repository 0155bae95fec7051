package insight.engine.storage;

import java.util.List;

import insight.engine.catalog.DatasetKind;

/** One course section. Component order matches {@link DatasetKind#SECTIONS}. */
public record SectionRecord(String uuid, String id, String title, String instructor, String dept,
                            int year, double avg, int pass, int fail, int audit) implements Record {

    public SectionRecord {
        if (uuid == null || id == null || title == null || instructor == null || dept == null) {
            throw new IllegalArgumentException("Section string fields must not be null");
        }
    }

    /** Builds a section from values laid out in schema order. */
    public static SectionRecord fromValues(List<Object> v) {
        if (v.size() != DatasetKind.SECTIONS.fields().size()) throw new IllegalArgumentException("Expected " + DatasetKind.SECTIONS.fields().size() + " values but got " + v.size());
        return new SectionRecord((String) v.get(0), (String) v.get(1), (String) v.get(2), (String) v.get(3), (String) v.get(4),
            Record.toInt(v.get(5)), ((Number) v.get(6)).doubleValue(), Record.toInt(v.get(7)),
            Record.toInt(v.get(8)), Record.toInt(v.get(9)));
    }

    @Override
    public DatasetKind kind() { return DatasetKind.SECTIONS; }

    @Override
    public List<Object> values() {
        return List.of(uuid, id, title, instructor, dept, year, avg, pass, fail, audit);
    }
}
