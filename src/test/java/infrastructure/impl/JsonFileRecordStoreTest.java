package infrastructure.impl;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import domain.exception.StorageException;
import domain.model.Item;
import domain.model.ItemCreate;
import domain.validation.ItemValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileRecordStoreTest {

    @TempDir Path tmp;

    private static Item item(int id, String name) {
        return new Item(id, name, null, 1.5, "2025-01-01T10:00:00.000000", "2025-01-01T10:00:00.000000");
    }

    @Test
    void missingFileLoadsEmpty() {
        JsonFileRecordStore store = new JsonFileRecordStore(tmp.resolve("data.json"));
        assertTrue(store.load().isEmpty());
        assertFalse(Files.exists(tmp.resolve("data.json")), "load must not create the file");
    }

    @Test
    void malformedContentLoadsEmpty() throws IOException {
        Path file = tmp.resolve("data.json");
        JsonFileRecordStore store = new JsonFileRecordStore(file);

        String ts = "\"created_at\":\"2025-01-01T10:00:00.000000\",\"updated_at\":\"2025-01-01T10:00:00.000000\"";
        String[] junkFiles = {
                "{ not json", "", "   ", "{}", "[1,2,3]", "\"text\"", "[{\"id\":\"abc\"}]",
                "[{\"id\":1}]",
                "[{\"id\":1,\"name\":\"a\",\"price\":0," + ts + "}]",
                "[{\"id\":1,\"name\":\"a\",\"price\":-2," + ts + "}]",
                "[{\"id\":1,\"price\":3," + ts + "}]",
                "[{\"id\":1,\"name\":\"a\",\"price\":3}]",
                "[{\"id\":1,\"name\":\"a\",\"price\":3," + ts + "},{\"id\":1,\"name\":\"b\",\"price\":3," + ts + "}]"
        };
        for (String junk : junkFiles) {
            Files.writeString(file, junk, StandardCharsets.UTF_8);
            assertTrue(store.load().isEmpty(), "expected empty for: " + junk);
        }
    }

    @Test
    void saveCreatesFileAndDirectories() {
        Path file = tmp.resolve("nested").resolve("dir").resolve("data.json");
        JsonFileRecordStore store = new JsonFileRecordStore(file);
        store.save(List.of(item(1, "a")));
        assertTrue(Files.exists(file));
        assertEquals(List.of(item(1, "a")), store.load());
    }

    @Test
    void saveThenLoadKeepsOrderAndFields() throws IOException {
        Path file = tmp.resolve("data.json");
        JsonFileRecordStore store = new JsonFileRecordStore(file);
        List<Item> items = List.of(item(3, "c"), item(1, "a"),
                new Item(2, "b", "with description", 12.5, "2025-01-01T10:00:00.000000", "2025-01-02T10:00:00.000000"));
        store.save(items);

        assertEquals(items, store.load());

        // on-disk layout: array of objects with snake_case keys, null description kept
        JsonArray root = JsonParser.parseString(Files.readString(file, StandardCharsets.UTF_8)).getAsJsonArray();
        assertEquals(3, root.size());
        JsonObject first = root.get(0).getAsJsonObject();
        assertEquals(3, first.get("id").getAsInt());
        assertTrue(first.has("description"));
        assertTrue(first.get("description").isJsonNull());
        assertTrue(first.has("created_at"));
        assertTrue(first.has("updated_at"));
    }

    @Test
    void saveOverwritesAndLeavesNoTempFile() throws IOException {
        Path file = tmp.resolve("data.json");
        JsonFileRecordStore store = new JsonFileRecordStore(file);
        store.save(List.of(item(1, "a"), item(2, "b")));
        store.save(List.of(item(2, "b")));

        assertEquals(List.of(item(2, "b")), store.load());
        try (var files = Files.list(tmp)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void emptyCollectionIsWrittenAsEmptyArray() throws IOException {
        Path file = tmp.resolve("data.json");
        JsonFileRecordStore store = new JsonFileRecordStore(file);
        store.save(new ArrayList<>());
        assertEquals("[]", Files.readString(file, StandardCharsets.UTF_8).trim());
    }

    @Test
    void saveFailurePropagates() throws IOException {
        // parent "directory" is a regular file, so the write cannot happen
        Path blocker = tmp.resolve("blocker");
        Files.writeString(blocker, "x");
        JsonFileRecordStore store = new JsonFileRecordStore(blocker.resolve("data.json"));
        assertThrows(StorageException.class, () -> store.save(List.of(item(1, "a"))));
    }

    @Test
    void validItemsSurviveTheLoadCheck() throws IOException {
        Path file = tmp.resolve("data.json");
        Files.writeString(file, "[{\"id\":4,\"name\":\"a\",\"description\":null,\"price\":3,"
                + "\"created_at\":\"2025-01-01T10:00:00.000000\",\"updated_at\":\"2025-01-01T10:00:00.000000\"}]",
                StandardCharsets.UTF_8);
        List<Item> items = new JsonFileRecordStore(file).load();
        assertEquals(1, items.size());
        assertEquals(4, items.get(0).getId());
    }

    @Test
    void nextIdRefusesToWrapPastMaxValue() throws IOException {
        Path file = tmp.resolve("data.json");
        JsonFileRecordStore store = new JsonFileRecordStore(file);
        store.save(List.of(item(Integer.MAX_VALUE, "last")));

        List<Item> loaded = store.load();
        assertThrows(StorageException.class, () -> store.nextId(loaded));

        // create through the service fails and leaves the file as it was
        String before = Files.readString(file, StandardCharsets.UTF_8);
        ItemServiceImpl service = new ItemServiceImpl(store, new ItemValidator(), new StepClock());
        assertThrows(StorageException.class, () -> service.create(new ItemCreate("next", null, 1.0)));
        assertEquals(before, Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void nextIdIsOnePastMaximum() {
        JsonFileRecordStore store = new JsonFileRecordStore(tmp.resolve("data.json"));
        assertEquals(1, store.nextId(List.of()));
        assertEquals(2, store.nextId(List.of(item(1, "a"))));
        assertEquals(8, store.nextId(List.of(item(7, "a"), item(2, "b"))));
    }
}
