package jsonengine;

import java.util.List;

/**
 * An ordered, unmodifiable JSON array.
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonArray(List<JsonValue> value) implements JsonValue {
    public JsonArray {
        value = List.copyOf(value);
    }

    public JsonValue get(int index) {
        return value.get(index);
    }

    public int size() {
        return value.size();
    }
}
