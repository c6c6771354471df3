package infrastructure.impl;

import domain.exception.ItemNotFoundException;
import domain.interfaces.IItemService;
import domain.interfaces.IRecordStore;
import domain.model.Item;
import domain.model.ItemCreate;
import domain.model.ItemUpdate;
import domain.validation.ItemValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs every operation as validate, load, locate, mutate, save over the whole collection.
 * <p>
 * All load-mutate-save cycles go through one fair lock, so concurrent requests in this
 * process are applied in arrival order and cannot overwrite each other's writes.
 * Writers in other processes sharing the same file are not coordinated.
 */
public class ItemServiceImpl implements IItemService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemServiceImpl.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");

    private final IRecordStore store;
    private final ItemValidator validator;
    private final Clock clock;
    private final ReentrantLock gate = new ReentrantLock(true);

    public ItemServiceImpl(IRecordStore store, ItemValidator validator, Clock clock) {
        this.store = store;
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public Item create(ItemCreate create) {
        validator.validateCreate(create);
        gate.lock();
        try {
            List<Item> items = store.load();
            String now = now();
            Item item = new Item(store.nextId(items), create.name(), create.description(),
                    create.price(), now, now);
            items.add(item);
            store.save(items);
            LOGGER.info("created item id={}", item.getId());
            return item;
        } finally {
            gate.unlock();
        }
    }

    @Override
    public List<Item> list() {
        gate.lock();
        try {
            return store.load();
        } finally {
            gate.unlock();
        }
    }

    @Override
    public Item get(int id) {
        gate.lock();
        try {
            List<Item> items = store.load();
            return items.get(indexOf(items, id));
        } finally {
            gate.unlock();
        }
    }

    @Override
    public Item update(int id, ItemUpdate update) {
        validator.validateUpdate(update);
        gate.lock();
        try {
            List<Item> items = store.load();
            int idx = indexOf(items, id);
            Item existing = items.get(idx);
            Item updated = existing.apply(update, stampAfter(existing.getCreatedAt()));
            items.set(idx, updated);
            store.save(items);
            LOGGER.info("updated item id={}", id);
            return updated;
        } finally {
            gate.unlock();
        }
    }

    @Override
    public void delete(int id) {
        gate.lock();
        try {
            List<Item> items = store.load();
            items.remove(indexOf(items, id));
            store.save(items);
            LOGGER.info("deleted item id={}", id);
        } finally {
            gate.unlock();
        }
    }

    @Override
    public void deleteAll() {
        gate.lock();
        try {
            store.save(new ArrayList<>());
            LOGGER.info("deleted all items");
        } finally {
            gate.unlock();
        }
    }

    /** @return position of the first item with {@code id}; throws if there is none. */
    private static int indexOf(List<Item> items, int id) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getId() == id) return i;
        }
        throw new ItemNotFoundException(id);
    }

    private String now() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    // updated_at never goes below created_at, even if the clock stepped back
    private String stampAfter(String createdAt) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (createdAt == null) return now.format(TIMESTAMP);
        try {
            LocalDateTime created = LocalDateTime.parse(createdAt);
            if (now.isBefore(created)) return createdAt;
        } catch (DateTimeParseException e) {
            LOGGER.debug("unparseable created_at '{}', stamping now", createdAt);
        }
        return now.format(TIMESTAMP);
    }
}
