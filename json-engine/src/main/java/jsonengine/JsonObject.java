package jsonengine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An unmodifiable JSON object. Iteration follows insertion order.
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonObject(Map<String, JsonValue> value) implements JsonValue {
    public JsonObject {
        value.forEach((k, v) -> {
            Objects.requireNonNull(k, "key must not be null");
            Objects.requireNonNull(v, () -> "value for key '" + k + "' must not be null");
        });
        value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    public Optional<JsonValue> get(String key) {
        return Optional.ofNullable(value.get(key));
    }

    public int size() {
        return value.size();
    }
}
