package domain.validation;

import domain.model.ItemCreate;
import domain.model.ItemUpdate;

import java.util.ArrayList;
import java.util.List;

/**
 * Constraint checks shared by create and update:
 * <ul>
 *   <li>{@code name}: required, 1 to 100 characters</li>
 *   <li>{@code description}: optional, at most 500 characters</li>
 *   <li>{@code price}: required, finite and strictly greater than 0</li>
 * </ul>
 * Lengths are counted in code points.
 */
public final class ItemValidator {

    public static final int NAME_MIN = 1;
    public static final int NAME_MAX = 100;
    public static final int DESCRIPTION_MAX = 500;

    public void validateCreate(ItemCreate create) {
        List<FieldError> errors = new ArrayList<>();
        if (create.name() == null) {
            errors.add(FieldError.body("name", "Field required", "missing"));
        } else {
            checkName(create.name(), errors);
        }
        if (create.description() != null) {
            checkDescription(create.description(), errors);
        }
        if (create.price() == null) {
            errors.add(FieldError.body("price", "Field required", "missing"));
        } else {
            checkPrice(create.price(), errors);
        }
        throwIfAny(errors);
    }

    /** Only supplied fields are checked. Explicit null is allowed for description alone. */
    public void validateUpdate(ItemUpdate update) {
        List<FieldError> errors = new ArrayList<>();
        update.name().ifPresent(name -> {
            if (name == null) errors.add(FieldError.body("name", "Input should be a valid string", "string_type"));
            else checkName(name, errors);
        });
        update.description().ifPresent(description -> {
            if (description != null) checkDescription(description, errors);
        });
        update.price().ifPresent(price -> {
            if (price == null) errors.add(FieldError.body("price", "Input should be a valid number", "float_type"));
            else checkPrice(price, errors);
        });
        throwIfAny(errors);
    }

    private static void checkName(String name, List<FieldError> errors) {
        int len = length(name);
        if (len < NAME_MIN) {
            errors.add(FieldError.body("name",
                    "String should have at least " + NAME_MIN + " character", "string_too_short"));
        } else if (len > NAME_MAX) {
            errors.add(FieldError.body("name",
                    "String should have at most " + NAME_MAX + " characters", "string_too_long"));
        }
    }

    private static void checkDescription(String description, List<FieldError> errors) {
        if (length(description) > DESCRIPTION_MAX) {
            errors.add(FieldError.body("description",
                    "String should have at most " + DESCRIPTION_MAX + " characters", "string_too_long"));
        }
    }

    private static void checkPrice(double price, List<FieldError> errors) {
        if (!Double.isFinite(price)) {
            errors.add(FieldError.body("price", "Input should be a finite number", "finite_number"));
        } else if (price <= 0) {
            errors.add(FieldError.body("price", "Input should be greater than 0", "greater_than"));
        }
    }

    private static int length(String s) {
        return s.codePointCount(0, s.length());
    }

    private static void throwIfAny(List<FieldError> errors) {
        if (!errors.isEmpty()) throw new ValidationException(errors);
    }
}
