package jsonengine;

/**
 * Exception thrown when JSON text cannot be obtained or parsed.
 * This is the base exception for all json-engine errors.
 *
 * @author Freeman
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    /**
     * Constructs a new JsonException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsonException(String message) {
        super(message);
    }

    /**
     * Constructs a new JsonException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Exception thrown when the input text violates the JSON grammar.
     *
     * <p> Always carries the position of the first offending character or token.
     */
    public static class SyntaxException extends JsonException {

        public enum Kind {
            UNEXPECTED_CHARACTER,
            UNEXPECTED_TOKEN,
            UNEXPECTED_END_OF_INPUT,
            UNTERMINATED_STRING,
            INVALID_LITERAL,
            INVALID_NUMBER,
            INVALID_ESCAPE,
            INVALID_UNICODE,
            CONTROL_CHARACTER,
            TRAILING_DATA,
            DEPTH_EXCEEDED
        }

        private final Kind kind;
        private final String detail;
        private final int position;
        private final int line;
        private final int column;

        public SyntaxException(Kind kind, String detail, int position, int line, int column) {
            super(String.format("%s at position %d (line %d, column %d)", detail, position, line, column));
            this.kind = kind;
            this.detail = detail;
            this.position = position;
            this.line = line;
            this.column = column;
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * @return the message without the position suffix
         */
        public String getDetail() {
            return detail;
        }

        /**
         * @return 0-based character offset into the input
         */
        public int getPosition() {
            return position;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Exception thrown when input text could not be read or decoded, before any parsing happened.
     */
    public static class ReadException extends JsonException {
        private final String path;

        public ReadException(String message, String path, Throwable cause) {
            super(String.format("%s: %s", message, path), cause);
            this.path = path;
        }

        public String getPath() {
            return path;
        }
    }
}
