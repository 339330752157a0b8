package jsonengine;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a parse or load: either a value or the {@link JsonException} that prevented it.
 *
 * <p> A failure never carries a partial value.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonResult<JsonValue> result = Json.tryParse("[1, 2");
 * if (result instanceof JsonResult.Failure<JsonValue> f) {
 *     System.err.println(f.error().getMessage());
 * }
 * }</pre>
 *
 * @param <T> the success type
 * @author Freeman
 * @since 0.1.0
 */
public sealed interface JsonResult<T> permits JsonResult.Success, JsonResult.Failure {

    static <T> JsonResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> JsonResult<T> failure(JsonException error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    /**
     * @return the value
     * @throws IllegalStateException if this is a failure
     */
    T value();

    /**
     * @return the error
     * @throws IllegalStateException if this is a success
     */
    JsonException error();

    /**
     * Unwraps the value, rethrowing the carried exception on failure.
     */
    T orElseThrow();

    <R> JsonResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Chains a step that can itself fail.
     */
    <R> JsonResult<R> flatMap(Function<? super T, JsonResult<R>> mapper);

    record Success<T>(T value) implements JsonResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public JsonException error() {
            throw new IllegalStateException("Success has no error");
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <R> JsonResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> JsonResult<R> flatMap(Function<? super T, JsonResult<R>> mapper) {
            return mapper.apply(value);
        }
    }

    record Failure<T>(JsonException error) implements JsonResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Failure has no value: " + error.getMessage(), error);
        }

        @Override
        public T orElseThrow() {
            throw error;
        }

        @Override
        public <R> JsonResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <R> JsonResult<R> flatMap(Function<? super T, JsonResult<R>> mapper) {
            return new Failure<>(error);
        }
    }
}
