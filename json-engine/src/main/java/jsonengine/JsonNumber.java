package jsonengine;

/**
 * A JSON number. Integer and fractional literals alike are held as a {@code double}.
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonNumber(double value) implements JsonValue {
    public JsonNumber {
        if (!Double.isFinite(value)) throw new IllegalArgumentException("JSON numbers must be finite: " + value);
    }
}
