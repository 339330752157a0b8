package jsonengine;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;

/**
 * An immutable JSON value: exactly one of null, boolean, number, string, array or object.
 *
 * @author Freeman
 * @since 0.1.0
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {

    /**
     * @return compact JSON text for this value
     */
    default String stringify() {
        return Json.stringify(this);
    }

    default boolean isNull() {
        return this instanceof JsonNull;
    }

    default Optional<Boolean> asBoolean() {
        return this instanceof JsonBoolean b ? Optional.of(b.value()) : Optional.empty();
    }

    default OptionalDouble asNumber() {
        return this instanceof JsonNumber n ? OptionalDouble.of(n.value()) : OptionalDouble.empty();
    }

    default Optional<String> asString() {
        return this instanceof JsonString s ? Optional.of(s.value()) : Optional.empty();
    }

    default Optional<JsonArray> asArray() {
        return this instanceof JsonArray a ? Optional.of(a) : Optional.empty();
    }

    default Optional<JsonObject> asObject() {
        return this instanceof JsonObject o ? Optional.of(o) : Optional.empty();
    }

    /**
     * Build a value tree from plain Java objects.
     *
     * <p> Supports {@code null}, {@link Boolean}, {@link Number}, {@link CharSequence}, {@link Character},
     * arrays, {@link Iterable}, {@link Map} (keys via {@link String#valueOf(Object)}) and records.
     *
     * @param o any supported object, may be {@code null}
     * @return the equivalent tree
     * @throws JsonException if a type is unsupported or a number is not finite
     */
    @SneakyThrows
    static JsonValue fromJavaObject(@Nullable Object o) {
        if (o == null) return new JsonNull();
        if (o instanceof JsonValue jsonValue) return jsonValue;
        if (o instanceof Boolean bool) return new JsonBoolean(bool);
        if (o instanceof Number number) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) throw new JsonException("Cannot represent non-finite number: " + number);
            return new JsonNumber(d);
        }
        if (o instanceof CharSequence string) return new JsonString(string.toString());
        if (o instanceof Character c) return new JsonString(String.valueOf(c));
        if (o.getClass().isArray()) {
            int len = Array.getLength(o);
            var values = new ArrayList<JsonValue>(len);
            for (int i = 0; i < len; i++) {
                values.add(fromJavaObject(Array.get(o, i)));
            }
            return new JsonArray(values);
        }
        if (o instanceof Iterable<?> array) {
            var values = new ArrayList<JsonValue>();
            for (var e : array) {
                values.add(fromJavaObject(e));
            }
            return new JsonArray(values);
        }
        if (o instanceof Map<?, ?> object) {
            var values = new LinkedHashMap<String, JsonValue>();
            for (var en : object.entrySet()) {
                values.put(String.valueOf(en.getKey()), fromJavaObject(en.getValue()));
            }
            return new JsonObject(values);
        }
        if (o instanceof Record object) {
            var values = new LinkedHashMap<String, JsonValue>();
            for (var e : object.getClass().getRecordComponents()) {
                values.put(e.getName(), fromJavaObject(e.getAccessor().invoke(object)));
            }
            return new JsonObject(values);
        }
        throw new JsonException("Unsupported type " + o.getClass().getName() + " for JSON conversion");
    }
}
