package domain.model;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * One updatable attribute of a partial update: either absent from the request,
 * or present with a value. A present value may be {@code null}, which is
 * different from the attribute being absent.
 *
 * @param <T> attribute type
 */
public final class FieldUpdate<T> {

    private static final FieldUpdate<?> ABSENT = new FieldUpdate<>(false, null);

    private final boolean present;
    private final T value;

    private FieldUpdate(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldUpdate<T> absent() {
        return (FieldUpdate<T>) ABSENT;
    }

    public static <T> FieldUpdate<T> of(T value) {
        return new FieldUpdate<>(true, value);
    }

    public boolean isPresent() { return present; }

    /** @return the supplied value, possibly null; throws if the field was not supplied. */
    public T get() {
        if (!present) throw new IllegalStateException("field was not supplied");
        return value;
    }

    /** @return the supplied value when present, otherwise {@code current}. */
    public T orElse(T current) {
        return present ? value : current;
    }

    public void ifPresent(Consumer<? super T> action) {
        if (present) action.accept(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldUpdate)) return false;
        FieldUpdate<?> that = (FieldUpdate<?>) o;
        return present == that.present && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "FieldUpdate[" + value + "]" : "FieldUpdate[absent]";
    }
}
