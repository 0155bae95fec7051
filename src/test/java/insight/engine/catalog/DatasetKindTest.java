package insight.engine.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class DatasetKindTest {

    @Test
    void sectionsSchema() {
        DatasetKind k = DatasetKind.SECTIONS;
        for (String f : List.of("avg", "pass", "fail", "audit", "year")) assertTrue(k.isNumeric(f), f);
        for (String f : List.of("dept", "id", "instructor", "title", "uuid")) assertTrue(k.isString(f), f);
        assertNull(k.typeOf("seats"));
        assertEquals(10, k.fields().size());
    }

    @Test
    void roomsSchema() {
        DatasetKind k = DatasetKind.ROOMS;
        for (String f : List.of("lat", "lon", "seats")) assertTrue(k.isNumeric(f), f);
        for (String f : List.of("fullname", "shortname", "number", "name", "address", "type", "furniture", "href")) {
            assertTrue(k.isString(f), f);
        }
        assertFalse(k.isNumeric("avg"));
        assertFalse(k.isString("dept"));
    }

    @Test
    void indexOfFollowsFieldOrder() {
        assertEquals(0, DatasetKind.SECTIONS.indexOf("uuid"));
        assertEquals(6, DatasetKind.SECTIONS.indexOf("avg"));
        assertEquals(7, DatasetKind.ROOMS.indexOf("seats"));
        assertEquals(-1, DatasetKind.ROOMS.indexOf("avg"));
    }

    @Test
    void fromLabel() {
        assertEquals(DatasetKind.ROOMS, DatasetKind.fromLabel("rooms"));
        assertEquals(DatasetKind.SECTIONS, DatasetKind.fromLabel(" Sections "));
        assertThrows(IllegalArgumentException.class, () -> DatasetKind.fromLabel("courses"));
    }
}
