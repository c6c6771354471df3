package domain.interfaces;

import domain.exception.StorageException;
import domain.model.Item;

import java.util.List;

/** Full-collection persistence: every call reads or writes the whole collection. */
public interface IRecordStore {

    /** @return every stored item in insertion order; empty if nothing valid is stored. */
    List<Item> load();

    /** Replace the stored collection; must never leave a partially written state behind. */
    void save(List<Item> items);

    /**
     * @return 1 for an empty collection, otherwise one more than the highest id
     * @throws StorageException when the highest id is already {@link Integer#MAX_VALUE}
     */
    default int nextId(List<Item> items) {
        if (items.isEmpty()) return 1;
        int max = Integer.MIN_VALUE;
        for (Item item : items) max = Math.max(max, item.getId());
        try {
            return Math.addExact(max, 1);
        } catch (ArithmeticException e) {
            throw new StorageException("item id space exhausted at " + max, e);
        }
    }
}
