package insight.engine.storage;

import java.util.List;

import insight.engine.catalog.DatasetKind;

/** One campus room. Component order matches {@link DatasetKind#ROOMS}. */
public record RoomRecord(String fullname, String shortname, String number, String name, String address,
                         double lat, double lon, int seats, String type, String furniture, String href) implements Record {

    public RoomRecord {
        if (fullname == null || shortname == null || number == null || name == null || address == null
            || type == null || furniture == null || href == null) {
            throw new IllegalArgumentException("Room string fields must not be null");
        }
    }

    /** Builds a room from values laid out in schema order. */
    public static RoomRecord fromValues(List<Object> v) {
        if (v.size() != DatasetKind.ROOMS.fields().size()) throw new IllegalArgumentException("Expected " + DatasetKind.ROOMS.fields().size() + " values but got " + v.size());
        return new RoomRecord((String) v.get(0), (String) v.get(1), (String) v.get(2), (String) v.get(3), (String) v.get(4),
            ((Number) v.get(5)).doubleValue(), ((Number) v.get(6)).doubleValue(), Record.toInt(v.get(7)),
            (String) v.get(8), (String) v.get(9), (String) v.get(10));
    }

    @Override
    public DatasetKind kind() { return DatasetKind.ROOMS; }

    @Override
    public List<Object> values() {
        return List.of(fullname, shortname, number, name, address, lat, lon, seats, type, furniture, href);
    }
}
