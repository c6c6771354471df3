package infrastructure.impl;

import domain.interfaces.IRecordStore;
import domain.model.Item;

import java.util.ArrayList;
import java.util.List;

/** Record store test double; hands out copies so callers cannot mutate stored state. */
public class InMemoryRecordStore implements IRecordStore {
    private List<Item> items = new ArrayList<>();
    private int saves;
    private RuntimeException failOnSave;

    @Override
    public synchronized List<Item> load() {
        return new ArrayList<>(items);
    }

    @Override
    public synchronized void save(List<Item> items) {
        if (failOnSave != null) throw failOnSave;
        this.items = new ArrayList<>(items);
        saves++;
    }

    public synchronized int saves() { return saves; }

    public synchronized void failOnSave(RuntimeException e) { this.failOnSave = e; }
}
