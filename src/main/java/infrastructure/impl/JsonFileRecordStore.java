package infrastructure.impl;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import domain.exception.StorageException;
import domain.interfaces.IRecordStore;
import domain.model.Item;
import infrastructure.util.FilePersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the item collection as one JSON array in a single file.
 * <p>
 * A missing file, an unreadable one, or one whose content is not a JSON array of
 * items loads as an empty collection. Save failures propagate as {@link StorageException}.
 */
public class JsonFileRecordStore implements IRecordStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileRecordStore.class);
    private static final Type ITEM_LIST = new TypeToken<List<Item>>() {}.getType();

    private final Path file;
    private final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    public JsonFileRecordStore(Path file) {
        this.file = file;
    }

    @Override
    public List<Item> load() {
        String json = FilePersistence.readOrNull(file);
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            List<Item> items = gson.fromJson(json, ITEM_LIST);
            if (items == null) return new ArrayList<>();
            List<Item> out = new ArrayList<>(items.size());
            Set<Integer> ids = new HashSet<>();
            for (Item item : items) {
                if (item == null) continue;
                String problem = problem(item, ids);
                if (problem != null) {
                    LOGGER.warn("{} holds an invalid item ({}), treating as empty", file, problem);
                    return new ArrayList<>();
                }
                out.add(item);
            }
            return out;
        } catch (JsonParseException | IllegalStateException e) {
            LOGGER.warn("{} is not a valid item collection, treating as empty: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    // null when the item satisfies the record invariants
    private static String problem(Item item, Set<Integer> seenIds) {
        if (!seenIds.add(item.getId())) return "duplicate id " + item.getId();
        if (item.getName() == null) return "id " + item.getId() + " has no name";
        if (!Double.isFinite(item.getPrice()) || item.getPrice() <= 0) {
            return "id " + item.getId() + " has price " + item.getPrice();
        }
        if (item.getCreatedAt() == null || item.getUpdatedAt() == null) {
            return "id " + item.getId() + " is missing a timestamp";
        }
        return null;
    }

    @Override
    public void save(List<Item> items) {
        String json = gson.toJson(items, ITEM_LIST);
        try {
            FilePersistence.saveAtomically(json, file);
        } catch (IOException e) {
            throw new StorageException("could not write " + file, e);
        }
        LOGGER.debug("saved {} item(s) to {}", items.size(), file);
    }
}
