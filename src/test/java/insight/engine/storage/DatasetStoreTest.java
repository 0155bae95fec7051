package insight.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import insight.engine.TestDatasets;
import insight.engine.catalog.DatasetKind;

public class DatasetStoreTest {

    @Test
    void addListRemove() {
        DatasetStore store = new DatasetStore();
        assertEquals(List.of("sections"), store.addDataset("sections", DatasetKind.SECTIONS, TestDatasets.threeSections()));
        assertEquals(List.of("sections", "rooms"), store.addDataset("rooms", DatasetKind.ROOMS, TestDatasets.rooms()));
        assertEquals(DatasetKind.ROOMS, store.registry().kindOf("rooms"));

        List<DatasetInfo> infos = store.listDatasets();
        assertEquals(new DatasetInfo("sections", DatasetKind.SECTIONS, 3), infos.get(0));
        assertEquals(new DatasetInfo("rooms", DatasetKind.ROOMS, 4), infos.get(1));

        assertEquals("sections", store.removeDataset("sections"));
        assertNull(store.recordsOf("sections"));
        assertNull(store.registry().kindOf("sections"));
        assertEquals(1, store.listDatasets().size());
    }

    @Test
    void rejectsInvalidIds() {
        DatasetStore store = new DatasetStore();
        assertThrows(IllegalArgumentException.class, () -> store.addDataset("", DatasetKind.SECTIONS, TestDatasets.threeSections()));
        assertThrows(IllegalArgumentException.class, () -> store.addDataset("   ", DatasetKind.SECTIONS, TestDatasets.threeSections()));
        assertThrows(IllegalArgumentException.class, () -> store.addDataset("my_sections", DatasetKind.SECTIONS, TestDatasets.threeSections()));
        assertThrows(IllegalArgumentException.class, () -> store.removeDataset("a_b"));
        assertTrue(store.listDatasets().isEmpty());
    }

    @Test
    void rejectsDuplicatesEmptyAndMismatchedKinds() {
        DatasetStore store = new DatasetStore();
        store.addDataset("sections", DatasetKind.SECTIONS, TestDatasets.threeSections());
        assertThrows(IllegalArgumentException.class, () -> store.addDataset("sections", DatasetKind.SECTIONS, TestDatasets.threeSections()));
        assertThrows(IllegalArgumentException.class, () -> store.addDataset("empty", DatasetKind.SECTIONS, List.of()));
        assertThrows(IllegalArgumentException.class, () -> store.addDataset("mixed", DatasetKind.SECTIONS, TestDatasets.rooms()));
        assertEquals(1, store.listDatasets().size());
    }

    @Test
    void removeUnknownIsNotFound() {
        DatasetStore store = new DatasetStore();
        assertThrows(DatasetNotFoundException.class, () -> store.removeDataset("nothing"));
    }

    @Test
    void readRunsActionAndReturnsItsValue() {
        DatasetStore store = TestDatasets.store();
        assertEquals(3, store.read(() -> store.recordsOf("sections").size()));
    }
}
