package jsonengine;

/**
 * JSON {@code null}.
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonNull() implements JsonValue {}
