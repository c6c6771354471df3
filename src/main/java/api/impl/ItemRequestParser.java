package api.impl;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;
import domain.exception.ItemNotFoundException;
import domain.model.FieldUpdate;
import domain.model.ItemCreate;
import domain.model.ItemUpdate;
import domain.validation.FieldError;
import domain.validation.ValidationException;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns request bodies into {@link ItemCreate} / {@link ItemUpdate}.
 * <p>
 * Works on the {@link JsonObject} tree so that a key that is missing and a key whose
 * value is {@code null} stay distinguishable. Only JSON types are checked here; range
 * and length constraints belong to {@link domain.validation.ItemValidator}.
 * Unknown keys, including {@code id} and the timestamps, are ignored.
 */
public final class ItemRequestParser {

    // strict: the adapter keeps the reader's leniency, unlike Gson.fromJson / JsonParser
    private static final TypeAdapter<JsonElement> ELEMENT = new Gson().getAdapter(JsonElement.class);

    public ItemCreate parseCreate(String body) {
        JsonObject o = object(body);
        List<FieldError> errors = new ArrayList<>();
        String name = string(o, "name", errors);
        String description = string(o, "description", errors);
        Double price = number(o, "price", errors);
        if (!errors.isEmpty()) throw new ValidationException(errors);
        return new ItemCreate(name, description, price);
    }

    public ItemUpdate parseUpdate(String body) {
        JsonObject o = object(body);
        List<FieldError> errors = new ArrayList<>();
        FieldUpdate<String> name = o.has("name") ? FieldUpdate.of(string(o, "name", errors)) : FieldUpdate.absent();
        FieldUpdate<String> description = o.has("description")
                ? FieldUpdate.of(string(o, "description", errors)) : FieldUpdate.absent();
        FieldUpdate<Double> price = o.has("price") ? FieldUpdate.of(number(o, "price", errors)) : FieldUpdate.absent();
        if (!errors.isEmpty()) throw new ValidationException(errors);
        return new ItemUpdate(name, description, price);
    }

    /**
     * Parses a path segment as an item id. A well-formed integer outside the id range
     * cannot name a stored item, so it is reported as not found.
     */
    public static int parseId(String raw) {
        long id;
        try {
            id = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(new FieldError(List.of("path", "item_id"),
                    "Input should be a valid integer, unable to parse string as an integer", "int_parsing"));
        }
        if (id < Integer.MIN_VALUE || id > Integer.MAX_VALUE) throw new ItemNotFoundException(id);
        return (int) id;
    }

    private static JsonObject object(String body) {
        if (body == null || body.isBlank()) {
            throw new ValidationException(new FieldError(List.of("body"), "Field required", "missing"));
        }
        JsonElement root;
        try {
            JsonReader reader = new JsonReader(new StringReader(body));
            reader.setLenient(false);
            root = ELEMENT.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) throw new MalformedJsonException("trailing content");
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new ValidationException(new FieldError(List.of("body"), "JSON decode error", "json_invalid"));
        }
        if (!root.isJsonObject()) {
            throw new ValidationException(new FieldError(List.of("body"),
                    "Input should be a valid dictionary or object", "model_attributes_type"));
        }
        return root.getAsJsonObject();
    }

    // null for a missing key or JSON null
    private static String string(JsonObject o, String key, List<FieldError> errors) {
        JsonElement e = o.get(key);
        if (e == null || e.isJsonNull()) return null;
        if (e.isJsonPrimitive() && e.getAsJsonPrimitive().isString()) return e.getAsString();
        errors.add(FieldError.body(key, "Input should be a valid string", "string_type"));
        return null;
    }

    private static Double number(JsonObject o, String key, List<FieldError> errors) {
        JsonElement e = o.get(key);
        if (e == null || e.isJsonNull()) return null;
        if (e.isJsonPrimitive()) {
            JsonPrimitive p = e.getAsJsonPrimitive();
            if (p.isNumber()) return p.getAsDouble();
        }
        errors.add(FieldError.body(key, "Input should be a valid number", "float_type"));
        return null;
    }
}
