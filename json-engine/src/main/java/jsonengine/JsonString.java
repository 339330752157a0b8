package jsonengine;

import java.util.Objects;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonString(String value) implements JsonValue {
    public JsonString {
        Objects.requireNonNull(value, "value");
    }
}
