package domain.validation;

import java.util.List;
import java.util.Objects;

/** One rejected input location, e.g. {@code ["body","price"]}. */
public final class FieldError {
    private final List<String> loc;
    private final String msg;
    private final String type;

    public FieldError(List<String> loc, String msg, String type) {
        this.loc = List.copyOf(loc);
        this.msg = msg;
        this.type = type;
    }

    public static FieldError body(String field, String msg, String type) {
        return new FieldError(List.of("body", field), msg, type);
    }

    public List<String> loc() { return loc; }
    public String msg() { return msg; }
    public String type() { return type; }

    /** @return last segment of {@link #loc()}, the field name. */
    public String field() { return loc.isEmpty() ? "" : loc.get(loc.size() - 1); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldError)) return false;
        FieldError that = (FieldError) o;
        return loc.equals(that.loc) && msg.equals(that.msg) && type.equals(that.type);
    }

    @Override
    public int hashCode() { return Objects.hash(loc, msg, type); }

    @Override
    public String toString() { return String.join(".", loc) + ": " + msg; }
}
