package domain.interfaces;

import domain.model.Item;
import domain.model.ItemCreate;
import domain.model.ItemUpdate;

import java.util.List;

public interface IItemService {
    Item create(ItemCreate create);
    List<Item> list();
    Item get(int id);                       // throws ItemNotFoundException
    Item update(int id, ItemUpdate update); // only supplied fields change
    void delete(int id);
    void deleteAll();
}
