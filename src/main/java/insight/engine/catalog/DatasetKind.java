package insight.engine.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The two closed dataset kinds and their fixed schemas.
 * Field order matches the component order of the corresponding record type,
 * so a field's position here is its index in {@code Record.values()}.
 */
public enum DatasetKind {
    SECTIONS("sections", List.of(
        new FieldSchema("uuid", FieldType.STRING),
        new FieldSchema("id", FieldType.STRING),
        new FieldSchema("title", FieldType.STRING),
        new FieldSchema("instructor", FieldType.STRING),
        new FieldSchema("dept", FieldType.STRING),
        new FieldSchema("year", FieldType.NUMERIC),
        new FieldSchema("avg", FieldType.NUMERIC),
        new FieldSchema("pass", FieldType.NUMERIC),
        new FieldSchema("fail", FieldType.NUMERIC),
        new FieldSchema("audit", FieldType.NUMERIC)
    )),
    ROOMS("rooms", List.of(
        new FieldSchema("fullname", FieldType.STRING),
        new FieldSchema("shortname", FieldType.STRING),
        new FieldSchema("number", FieldType.STRING),
        new FieldSchema("name", FieldType.STRING),
        new FieldSchema("address", FieldType.STRING),
        new FieldSchema("lat", FieldType.NUMERIC),
        new FieldSchema("lon", FieldType.NUMERIC),
        new FieldSchema("seats", FieldType.NUMERIC),
        new FieldSchema("type", FieldType.STRING),
        new FieldSchema("furniture", FieldType.STRING),
        new FieldSchema("href", FieldType.STRING)
    ));

    private final String label;
    private final List<FieldSchema> fields;
    private final Map<String, FieldSchema> byName;

    DatasetKind(String label, List<FieldSchema> fields) {
        this.label = label;
        this.fields = fields;
        Map<String, FieldSchema> m = new LinkedHashMap<>();
        for (FieldSchema f : fields) m.put(f.name(), f);
        this.byName = Collections.unmodifiableMap(m);
    }

    /** Lower-case name used in dataset files and listings. */
    public String label() { return label; }

    public List<FieldSchema> fields() { return fields; }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (FieldSchema f : fields) names.add(f.name());
        return names;
    }

    /** Returns the field's type, or null if this kind declares no such field. */
    public FieldType typeOf(String field) {
        FieldSchema f = byName.get(field);
        return f == null ? null : f.type();
    }

    public boolean isNumeric(String field) { return typeOf(field) == FieldType.NUMERIC; }

    public boolean isString(String field) { return typeOf(field) == FieldType.STRING; }

    /** Position of the field in this kind's record values, or -1. */
    public int indexOf(String field) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(field)) return i;
        }
        return -1;
    }

    public static DatasetKind fromLabel(String label) {
        if (label == null) throw new IllegalArgumentException("kind must not be null");
        for (DatasetKind k : values()) {
            if (k.label.equalsIgnoreCase(label.trim())) return k;
        }
        throw new IllegalArgumentException("Unknown dataset kind: " + label);
    }
}
