package domain.validation;

import domain.model.FieldUpdate;
import domain.model.ItemCreate;
import domain.model.ItemUpdate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ItemValidatorTest {

    private final ItemValidator v = new ItemValidator();

    @Test
    void acceptsMinimalCreate() {
        assertDoesNotThrow(() -> v.validateCreate(new ItemCreate("Widget", null, 9.99)));
    }

    @Test
    void nameBoundaries() {
        assertDoesNotThrow(() -> v.validateCreate(new ItemCreate("x".repeat(100), null, 1.0)));
        ValidationException tooLong = assertThrows(ValidationException.class,
                () -> v.validateCreate(new ItemCreate("x".repeat(101), null, 1.0)));
        assertEquals("string_too_long", tooLong.errors().get(0).type());
        ValidationException empty = assertThrows(ValidationException.class,
                () -> v.validateCreate(new ItemCreate("", null, 1.0)));
        assertEquals("name", empty.errors().get(0).field());
    }

    @Test
    void nameLengthCountsCodePoints() {
        // 100 emoji are 200 UTF-16 chars
        String emoji = "😀".repeat(100);
        assertDoesNotThrow(() -> v.validateCreate(new ItemCreate(emoji, null, 1.0)));
    }

    @Test
    void descriptionBoundaries() {
        assertDoesNotThrow(() -> v.validateCreate(new ItemCreate("a", "d".repeat(500), 1.0)));
        assertDoesNotThrow(() -> v.validateCreate(new ItemCreate("a", "", 1.0)));
        ValidationException e = assertThrows(ValidationException.class,
                () -> v.validateCreate(new ItemCreate("a", "d".repeat(501), 1.0)));
        assertEquals("description", e.errors().get(0).field());
    }

    @Test
    void priceMustBePositiveAndFinite() {
        assertThrows(ValidationException.class, () -> v.validateCreate(new ItemCreate("a", null, 0.0)));
        assertThrows(ValidationException.class, () -> v.validateCreate(new ItemCreate("a", null, -1.0)));
        assertThrows(ValidationException.class,
                () -> v.validateCreate(new ItemCreate("a", null, Double.POSITIVE_INFINITY)));
        assertDoesNotThrow(() -> v.validateCreate(new ItemCreate("a", null, 0.01)));
    }

    @Test
    void missingRequiredFieldsAreAllReported() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> v.validateCreate(new ItemCreate(null, null, null)));
        assertEquals(2, e.errors().size());
        assertEquals("missing", e.errors().get(0).type());
        assertEquals("price", e.errors().get(1).field());
    }

    @Test
    void updateChecksOnlySuppliedFields() {
        assertDoesNotThrow(() -> v.validateUpdate(ItemUpdate.empty()));
        assertDoesNotThrow(() -> v.validateUpdate(new ItemUpdate(
                FieldUpdate.absent(), FieldUpdate.of(null), FieldUpdate.of(12.5))));

        assertThrows(ValidationException.class, () -> v.validateUpdate(new ItemUpdate(
                FieldUpdate.absent(), FieldUpdate.absent(), FieldUpdate.of(0.0))));
        assertThrows(ValidationException.class, () -> v.validateUpdate(new ItemUpdate(
                FieldUpdate.of(""), FieldUpdate.absent(), FieldUpdate.absent())));
    }

    @Test
    void updateRejectsNullForNonNullableFields() {
        ValidationException name = assertThrows(ValidationException.class, () -> v.validateUpdate(new ItemUpdate(
                FieldUpdate.of(null), FieldUpdate.absent(), FieldUpdate.absent())));
        assertEquals("string_type", name.errors().get(0).type());
        ValidationException price = assertThrows(ValidationException.class, () -> v.validateUpdate(new ItemUpdate(
                FieldUpdate.absent(), FieldUpdate.absent(), FieldUpdate.of(null))));
        assertEquals("price", price.errors().get(0).field());
    }
}
