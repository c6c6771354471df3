package domain.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * One persisted item record. Serialized with snake_case keys, which is also the
 * layout of the backing JSON file.
 */
public final class Item {
    private final int id;
    private final String name;
    private final String description;
    private final double price;
    @SerializedName("created_at")
    private final String createdAt;
    @SerializedName("updated_at")
    private final String updatedAt;

    public Item(int id, String name, String description, double price,
                String createdAt, String updatedAt) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.price = price;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public double getPrice() { return price; }
    public String getCreatedAt() { return createdAt; }
    public String getUpdatedAt() { return updatedAt; }

    /**
     * Returns a copy with the supplied fields of {@code update} applied and
     * {@code updated_at} restamped. {@code id} and {@code created_at} are carried over.
     */
    public Item apply(ItemUpdate update, String updatedAt) {
        return new Item(
                id,
                update.name().orElse(name),
                update.description().orElse(description),
                update.price().orElse(price),
                createdAt,
                updatedAt
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item)) return false;
        Item item = (Item) o;
        return id == item.id
                && Double.compare(item.price, price) == 0
                && Objects.equals(name, item.name)
                && Objects.equals(description, item.description)
                && Objects.equals(createdAt, item.createdAt)
                && Objects.equals(updatedAt, item.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, price, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Item{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", description='" + description + '\'' +
                ", price=" + price +
                ", createdAt='" + createdAt + '\'' +
                ", updatedAt='" + updatedAt + '\'' +
                '}';
    }
}
