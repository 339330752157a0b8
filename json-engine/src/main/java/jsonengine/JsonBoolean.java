package jsonengine;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonBoolean(boolean value) implements JsonValue {}
