package domain.model;

/**
 * Payload of a partial update. Each attribute is a {@link FieldUpdate} so a field
 * left out of the request can be told apart from one explicitly set to null.
 */
public final class ItemUpdate {
    private final FieldUpdate<String> name;
    private final FieldUpdate<String> description;
    private final FieldUpdate<Double> price;

    public ItemUpdate(FieldUpdate<String> name, FieldUpdate<String> description, FieldUpdate<Double> price) {
        this.name = name == null ? FieldUpdate.absent() : name;
        this.description = description == null ? FieldUpdate.absent() : description;
        this.price = price == null ? FieldUpdate.absent() : price;
    }

    public static ItemUpdate empty() {
        return new ItemUpdate(FieldUpdate.absent(), FieldUpdate.absent(), FieldUpdate.absent());
    }

    public FieldUpdate<String> name() { return name; }
    public FieldUpdate<String> description() { return description; }
    public FieldUpdate<Double> price() { return price; }
}
