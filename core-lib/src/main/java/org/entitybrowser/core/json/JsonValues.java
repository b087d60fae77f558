package org.entitybrowser.core.json;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Optional;

/**
 * Small helpers for reading fields out of untyped Gson trees.
 */
public final class JsonValues {
    private JsonValues() {}

    /**
     * Returns the named top-level field of {@code value} when {@code value} is an object and the field is a JSON
     * string. Any other shape yields an empty result.
     */
    public static Optional<String> stringField(JsonElement value, String name) {
        if (value == null || !value.isJsonObject()) {
            return Optional.empty();
        }
        JsonElement field = value.getAsJsonObject().get(name);
        if (field == null || !field.isJsonPrimitive()) {
            return Optional.empty();
        }
        JsonPrimitive primitive = field.getAsJsonPrimitive();
        return primitive.isString() ? Optional.of(primitive.getAsString()) : Optional.empty();
    }

    /**
     * Same as {@link #stringField(JsonElement, String)} but treats an empty string as absent.
     */
    public static Optional<String> nonEmptyStringField(JsonElement value, String name) {
        return stringField(value, name).filter(s -> !s.isEmpty());
    }

    public static Optional<Boolean> booleanField(JsonObject object, String name) {
        JsonElement field = object.get(name);
        if (field == null || !field.isJsonPrimitive() || !field.getAsJsonPrimitive().isBoolean()) {
            return Optional.empty();
        }
        return Optional.of(field.getAsBoolean());
    }
}
