package domain.model;

/** Payload of a create request, after parsing and before validation. */
public final class ItemCreate {
    private final String name;
    private final String description;
    private final Double price;

    public ItemCreate(String name, String description, Double price) {
        this.name = name;
        this.description = description;
        this.price = price;
    }

    public String name() { return name; }
    public String description() { return description; }
    public Double price() { return price; }
}
