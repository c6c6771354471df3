package domain.exception;

/** No item with the requested id exists. Answered with 404. */
public class ItemNotFoundException extends RuntimeException {

    public ItemNotFoundException(long id) {
        super("Item with ID " + id + " not found");
    }
}
