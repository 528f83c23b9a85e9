package eu.lieko.store.json;

import com.google.gson.*;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;
import lombok.NonNull;

import java.io.IOException;
import java.io.StringReader;
import java.util.*;

/**
 * Gson-backed conversion between JSON text and normalized record values.
 * Integral numbers are read as {@link Long} (falling back to {@link Double} when out of range),
 * every other number as {@link Double}.
 */
public class JsonCodec {

    private final Gson gson;

    public JsonCodec() {
        this(new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create());
    }

    public JsonCodec(@NonNull Gson gson) {
        this.gson = gson;
    }

    // ==================== READ ====================

    /**
     * @throws JsonParseException if the text is not a single well-formed JSON value
     */
    public Object read(@NonNull String json) {
        JsonElement element;
        try {
            JsonReader reader = new JsonReader(new StringReader(json));
            reader.setLenient(false);
            element = this.gson.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new MalformedJsonException("Trailing data after JSON value");
            }
        } catch (IOException exception) {
            throw new JsonSyntaxException(exception);
        }
        return this.fromElement(element);
    }

    /**
     * @throws JsonParseException if the text is malformed or its root is not an object
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> readObject(@NonNull String json) {
        Object value = this.read(json);
        if (!(value instanceof Map)) {
            throw new JsonSyntaxException("Expected JSON object at root");
        }
        return (Map<String, Object>) value;
    }

    public Object fromElement(JsonElement element) {
        if ((element == null) || element.isJsonNull()) {
            return null;
        }

        if (element.isJsonObject()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                out.put(entry.getKey(), this.fromElement(entry.getValue()));
            }
            return out;
        }

        if (element.isJsonArray()) {
            List<Object> out = new ArrayList<>();
            for (JsonElement nested : element.getAsJsonArray()) {
                out.add(this.fromElement(nested));
            }
            return out;
        }

        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return readNumber(primitive.getAsString());
        }
        return primitive.getAsString();
    }

    private static Object readNumber(String text) {
        boolean integral = (text.indexOf('.') < 0) && (text.indexOf('e') < 0) && (text.indexOf('E') < 0);
        if (integral) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException ignored) {
                // out of long range, keep as double
            }
        }
        double value = Double.parseDouble(text);
        if (!Double.isFinite(value)) {
            throw new JsonSyntaxException("Number out of range: " + text);
        }
        return value;
    }

    // ==================== WRITE ====================

    public String write(Object value) {
        return this.gson.toJson(this.toElement(value));
    }

    public JsonElement toElement(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Map) {
            JsonObject object = new JsonObject();
            ((Map<?, ?>) value).forEach((key, nested) -> object.add(String.valueOf(key), this.toElement(nested)));
            return object;
        }
        if (value instanceof Collection) {
            JsonArray array = new JsonArray();
            ((Collection<?>) value).forEach(nested -> array.add(this.toElement(nested)));
            return array;
        }
        if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        if (value instanceof Number) {
            return new JsonPrimitive((Number) value);
        }
        return new JsonPrimitive(String.valueOf(value));
    }
}
