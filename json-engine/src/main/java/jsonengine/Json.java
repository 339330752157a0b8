package jsonengine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import jsonengine.JsonException.SyntaxException;
import jsonengine.JsonException.SyntaxException.Kind;
import lombok.Builder;
import org.jspecify.annotations.Nullable;

/**
 * Minimal, standard-first JSON parser and writer.
 *
 * <p> Every method here is stateless; the shared default {@link Parser} and {@link Writer} hold only configuration
 * and are safe to use from any thread.
 *
 * @author <a href="mailto:llw599502537@gmail.com">Freeman</a>
 */
public final class Json {

    private static final Writer defaultWriter = Writer.builder().build();
    private static final Parser defaultParser = Parser.builder().build();

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse JSON text into a value tree.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * JsonValue v = Json.parse("{\"users\": [{\"id\": 1}]}");
     * // -> JsonObject{users=JsonArray[JsonObject{id=JsonNumber[1.0]}]}
     * }</pre>
     *
     * @param json JSON text, not {@code null}
     * @return the root value, never {@code null}
     * @throws SyntaxException if the text is not a single well-formed JSON value
     */
    public static JsonValue parse(String json) {
        return defaultParser.parse(json);
    }

    /**
     * Parse JSON text without throwing for malformed input.
     *
     * @param json JSON text, not {@code null}
     * @return the root value, or the {@link SyntaxException} describing the first error
     */
    public static JsonResult<JsonValue> tryParse(String json) {
        return defaultParser.read(json);
    }

    /**
     * Read a UTF-8 file and parse its contents.
     *
     * @param path file path, not {@code null}
     * @return the root value
     * @throws JsonException.ReadException   if the file cannot be read or is not valid UTF-8
     * @throws SyntaxException if the contents are malformed
     */
    public static JsonValue parseFile(String path) {
        Objects.requireNonNull(path, "path");
        return JsonFiles.load(path).flatMap(defaultParser::read).orElseThrow();
    }

    /**
     * @see #parseFile(String)
     */
    public static JsonValue parseFile(Path path) {
        return tryParseFile(path).orElseThrow();
    }

    /**
     * Read a UTF-8 file and parse its contents without throwing for read or syntax failures.
     *
     * @param path file path, not {@code null}
     * @return the root value, or the {@link JsonException.ReadException} / {@link SyntaxException}
     */
    public static JsonResult<JsonValue> tryParseFile(Path path) {
        Objects.requireNonNull(path, "path");
        return JsonFiles.read(path, defaultParser);
    }

    /**
     * Serialize to compact JSON text.
     *
     * <p> Accepts a {@link JsonValue} or any object supported by {@link JsonValue#fromJavaObject(Object)}.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.stringify(Map.of("key", "value"));
     * // -> {"key":"value"}
     * }</pre>
     *
     * @param o value to write, may be {@code null}
     * @return non-null JSON text
     */
    public static String stringify(@Nullable Object o) {
        return defaultWriter.write(JsonValue.fromJavaObject(o));
    }

    /**
     * Serialize with {@code indent} spaces per nesting level; {@code 0} means compact.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.stringify(Map.of("key", "value"), 2);
     * // -> {
     * //      "key": "value"
     * //    }
     * }</pre>
     *
     * @param o      value to write, may be {@code null}
     * @param indent spaces per level, not negative
     * @return non-null JSON text
     */
    public static String stringify(@Nullable Object o, int indent) {
        var writer = indent == 0 ? defaultWriter : Writer.builder().indent(indent).build();
        return writer.write(JsonValue.fromJavaObject(o));
    }

    /**
     * Split JSON text into tokens, the last one being {@link Token.Kind#EOF}.
     *
     * @param json JSON text, not {@code null}
     * @return all tokens in order
     * @throws SyntaxException on the first lexical error
     */
    public static List<Token> tokenize(String json) {
        var lexer = new Lexer(json);
        var tokens = new ArrayList<Token>();
        while (true) {
            tokens.add(lexer.current());
            if (lexer.current().kind() == Token.Kind.EOF) return tokens;
            lexer.advance();
        }
    }

    // ============================================================
    // Lexer
    // ============================================================

    static final class Lexer {
        private final String s;
        private int i = 0, line = 1, col = 1;
        private int tokenLine = 1, tokenCol = 1;
        private Token current;
        private double numberValue;

        Lexer(String s) {
            this.s = Objects.requireNonNull(s, "json");
            advance();
        }

        Token current() {
            return current;
        }

        /**
         * @return the value of the current {@link Token.Kind#NUMBER} token
         */
        double number() {
            return numberValue;
        }

        int line() {
            return tokenLine;
        }

        int col() {
            return tokenCol;
        }

        void advance() {
            skipWs();
            int start = i;
            tokenLine = line;
            tokenCol = col;
            if (eof()) {
                current = new Token(Token.Kind.EOF, "", start);
                return;
            }
            char c = peek();
            switch (c) {
                case '{' -> punctuation(Token.Kind.LBRACE);
                case '}' -> punctuation(Token.Kind.RBRACE);
                case '[' -> punctuation(Token.Kind.LBRACKET);
                case ']' -> punctuation(Token.Kind.RBRACKET);
                case ':' -> punctuation(Token.Kind.COLON);
                case ',' -> punctuation(Token.Kind.COMMA);
                case '"' -> current = new Token(Token.Kind.STRING, readString(), start);
                case 't' -> readKeyword("true", Token.Kind.TRUE);
                case 'f' -> readKeyword("false", Token.Kind.FALSE);
                case 'n' -> readKeyword("null", Token.Kind.NULL);
                default -> {
                    if (c == '-' || isDigit(c)) {
                        current = new Token(Token.Kind.NUMBER, readNumber(), start);
                    } else error(Kind.UNEXPECTED_CHARACTER, "Unexpected character " + describe(c));
                }
            }
        }

        private void punctuation(Token.Kind kind) {
            int start = i;
            current = new Token(kind, String.valueOf(consume()), start);
        }

        private void skipWs() {
            while (!eof()) {
                char c = peek();
                if (c == ' ' || c == '\t' || c == '\r') consume();
                else if (c == '\n') {
                    consume();
                    line++;
                    col = 1;
                } else break;
            }
        }

        private String readString() {
            int quote = i;
            consume(); // opening "
            StringBuilder sb = new StringBuilder();
            while (!eof()) {
                char c = peek();
                if (c == '"') {
                    consume();
                    return sb.toString();
                }
                if (c == '\\') {
                    int escape = i;
                    consume();
                    if (eof()) break;
                    char e = peek();
                    switch (e) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            consume();
                            int cp = readHex4(quote, escape);
                            if (Character.isHighSurrogate((char) cp)) {
                                if (eof() || peek() != '\\' || peekNext() != 'u')
                                    errorAt(
                                            Kind.INVALID_UNICODE,
                                            "High surrogate not followed by low surrogate in unicode escape",
                                            escape);
                                int lowEscape = i;
                                consume();
                                consume();
                                int low = readHex4(quote, lowEscape);
                                if (!Character.isLowSurrogate((char) low))
                                    errorAt(Kind.INVALID_UNICODE, "Invalid low surrogate in unicode escape", escape);
                                sb.appendCodePoint(Character.toCodePoint((char) cp, (char) low));
                            } else if (Character.isLowSurrogate((char) cp)) {
                                errorAt(Kind.INVALID_UNICODE, "Unexpected low surrogate in unicode escape", escape);
                            } else sb.append((char) cp);
                            continue;
                        }
                        default -> error(Kind.INVALID_ESCAPE, "Invalid escape sequence '\\" + e + "'");
                    }
                    consume();
                } else {
                    if (c < 0x20)
                        error(Kind.CONTROL_CHARACTER, "Unescaped control character in string (ASCII " + (int) c + ")");
                    sb.append(consume());
                }
            }
            throw errorAt(Kind.UNTERMINATED_STRING, "Unterminated string", quote);
        }

        private int readHex4(int quote, int escape) {
            int cp = 0;
            for (int k = 0; k < 4; k++) {
                if (eof()) throw errorAt(Kind.UNTERMINATED_STRING, "Unterminated string", quote);
                int v = hexVal(peek());
                if (v < 0)
                    errorAt(
                            Kind.INVALID_UNICODE,
                            "Invalid unicode escape '\\u" + s.substring(escape + 2, Math.min(escape + 6, s.length()))
                                    + "'",
                            escape);
                consume();
                cp = (cp << 4) | v;
            }
            return cp;
        }

        private static int hexVal(char c) {
            if (c >= '0' && c <= '9') return c - '0';
            if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
            if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
            return -1;
        }

        private void readKeyword(String kw, Token.Kind kind) {
            int start = i;
            for (int k = 0; k < kw.length(); k++) {
                if (eof() || peek() != kw.charAt(k))
                    errorAt(Kind.INVALID_LITERAL, "Invalid literal, expected '" + kw + "'", start);
                consume();
            }
            current = new Token(kind, kw, start);
        }

        private String readNumber() {
            int start = i;
            if (peek() == '-') consume();
            if (eof() || !isDigit(peek())) errorAt(Kind.INVALID_NUMBER, "Invalid number: expected digit", start);
            if (peek() == '0') {
                consume();
                if (!eof() && isDigit(peek()))
                    errorAt(Kind.INVALID_NUMBER, "Invalid number: leading zeros are not allowed", start);
            } else while (!eof() && isDigit(peek())) consume();
            if (!eof() && peek() == '.') {
                consume();
                if (eof() || !isDigit(peek()))
                    errorAt(Kind.INVALID_NUMBER, "Invalid number: expected digit after '.'", start);
                while (!eof() && isDigit(peek())) consume();
            }
            if (!eof() && (peek() == 'e' || peek() == 'E')) {
                consume();
                if (!eof() && (peek() == '+' || peek() == '-')) consume();
                if (eof() || !isDigit(peek()))
                    errorAt(Kind.INVALID_NUMBER, "Invalid number: expected digit in exponent", start);
                while (!eof() && isDigit(peek())) consume();
            }
            String lexeme = s.substring(start, i);
            double d = Double.parseDouble(lexeme);
            if (Double.isInfinite(d)) errorAt(Kind.INVALID_NUMBER, "Number out of range: " + lexeme, start);
            numberValue = d;
            return lexeme;
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private char peekNext() {
            return (i + 1 < s.length()) ? s.charAt(i + 1) : '\0';
        }

        private char consume() {
            char c = s.charAt(i++);
            col++;
            return c;
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static String describe(char c) {
            return c < 0x20 ? "(ASCII " + (int) c + ")" : "'" + c + "'";
        }

        private SyntaxException error(Kind kind, String msg) {
            throw new SyntaxException(kind, msg, i, line, col);
        }

        // offset must lie on the current line: no token spans a raw newline
        private SyntaxException errorAt(Kind kind, String msg, int offset) {
            throw new SyntaxException(kind, msg, offset, line, col - (i - offset));
        }
    }

    // ============================================================
    // Writer
    // ============================================================

    /**
     * Renders a value tree as JSON text.
     *
     * <p> {@code indent == 0} writes compact text; a positive {@code indent} pretty-prints with that many spaces per
     * level. Empty containers are always written as {@code {}} and {@code []}.
     */
    @Builder(toBuilder = true)
    public static final class Writer {

        @Builder.Default
        private final int indent = 0;

        public String write(JsonValue value) {
            Objects.requireNonNull(value, "value");
            if (indent < 0) throw new IllegalArgumentException("indent must not be negative: " + indent);
            var sb = new StringBuilder();
            write(sb, value, 0);
            return sb.toString();
        }

        void write(StringBuilder out, JsonValue v, int level) {
            if (v instanceof JsonNull) {
                out.append("null");
                return;
            }
            if (v instanceof JsonBoolean b) {
                out.append(b.value() ? "true" : "false");
                return;
            }
            if (v instanceof JsonNumber n) {
                writeNumber(out, n.value());
                return;
            }
            if (v instanceof JsonString s) {
                writeString(out, s.value());
                return;
            }
            if (v instanceof JsonArray a) {
                List<JsonValue> vs = a.value();
                if (vs.isEmpty()) {
                    out.append("[]");
                    return;
                }
                out.append('[');
                for (int i = 0; i < vs.size(); i++) {
                    if (i > 0) out.append(',');
                    newline(out, level + 1);
                    write(out, vs.get(i), level + 1);
                }
                newline(out, level);
                out.append(']');
                return;
            }
            var o = (JsonObject) v;
            if (o.value().isEmpty()) {
                out.append("{}");
                return;
            }
            out.append('{');
            boolean first = true;
            for (var en : o.value().entrySet()) {
                if (!first) out.append(',');
                first = false;
                newline(out, level + 1);
                writeString(out, en.getKey());
                out.append(indent > 0 ? ": " : ":");
                write(out, en.getValue(), level + 1);
            }
            newline(out, level);
            out.append('}');
        }

        private void newline(StringBuilder out, int level) {
            if (indent == 0) return;
            out.append('\n');
            out.append(" ".repeat(indent * level));
        }

        static void writeNumber(StringBuilder out, double d) {
            if (d == 0 && 1 / d < 0) {
                out.append("-0");
                return;
            }
            // integral values print without a fraction while they are exactly representable as long
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                out.append((long) d);
                return;
            }
            BigDecimal shortest = shortestDecimal(d);
            double abs = Math.abs(d);
            if (abs >= 1e-3 && abs < 1e7) {
                out.append(shortest.toPlainString());
                return;
            }
            // d.dddE[-]n, the layout of Double.toString without a redundant ".0"
            String digits = shortest.unscaledValue().abs().toString();
            int exponent = digits.length() - 1 - shortest.scale();
            if (d < 0) out.append('-');
            out.append(digits.charAt(0));
            if (digits.length() > 1) out.append('.').append(digits, 1, digits.length());
            out.append('E').append(exponent);
        }

        /**
         * Fewest significant digits that parse back to exactly {@code d}.
         * {@link Double#toString(double)} does not guarantee this before JDK 19 ({@code 2e23} prints
         * {@code 1.9999999999999998E23}).
         */
        static BigDecimal shortestDecimal(double d) {
            var exact = new BigDecimal(d);
            for (int precision = 1; precision < 17; precision++) {
                var candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
                if (Double.parseDouble(candidate.toString()) == d) return candidate.stripTrailingZeros();
            }
            return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
        }

        static void writeString(StringBuilder out, String s) {
            out.append('"');
            escapeTo(out, s);
            out.append('"');
        }

        static void escapeTo(StringBuilder out, String s) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    default -> {
                        if (c < 0x20) {
                            out.append("\\u");
                            String hex = Integer.toHexString(c);
                            for (int k = hex.length(); k < 4; k++) out.append('0');
                            out.append(hex);
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * Recursive-descent parser. Stops at the first error; never returns a partial tree.
     */
    @Builder(toBuilder = true)
    public static final class Parser {

        public static final int DEFAULT_MAX_DEPTH = 512;

        /**
         * Deepest allowed nesting of arrays and objects; the root container is depth 1.
         */
        @Builder.Default
        private final int maxDepth = DEFAULT_MAX_DEPTH;

        /**
         * @param json JSON text, not {@code null}
         * @return the root value, or the {@link SyntaxException} for the first error
         */
        public JsonResult<JsonValue> read(String json) {
            Objects.requireNonNull(json, "json");
            try {
                return JsonResult.success(parseJsonValue(new Lexer(json)));
            } catch (SyntaxException e) {
                return JsonResult.failure(e);
            }
        }

        /**
         * @param json JSON text, not {@code null}
         * @return the root value
         * @throws SyntaxException for the first error
         */
        public JsonValue parse(String json) {
            return read(json).orElseThrow();
        }

        JsonValue parseJsonValue(Lexer lexer) {
            JsonValue v = parseValue(lexer, 0);
            if (lexer.current().kind() != Token.Kind.EOF)
                error(lexer, Kind.TRAILING_DATA, "Trailing data after top-level value: " + describe(lexer.current()));
            return v;
        }

        JsonValue parseValue(Lexer lexer, int depth) {
            Token token = lexer.current();
            return switch (token.kind()) {
                case LBRACE -> parseObject(lexer, depth + 1);
                case LBRACKET -> parseArray(lexer, depth + 1);
                case STRING -> {
                    lexer.advance();
                    yield new JsonString(token.text());
                }
                case NUMBER -> {
                    double d = lexer.number();
                    lexer.advance();
                    yield new JsonNumber(d);
                }
                case TRUE -> {
                    lexer.advance();
                    yield new JsonBoolean(true);
                }
                case FALSE -> {
                    lexer.advance();
                    yield new JsonBoolean(false);
                }
                case NULL -> {
                    lexer.advance();
                    yield new JsonNull();
                }
                case RBRACE, RBRACKET, COMMA, COLON, EOF -> throw unexpected(lexer, "JSON value");
            };
        }

        JsonObject parseObject(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            lexer.advance(); // {
            Map<String, JsonValue> m = new LinkedHashMap<>();
            if (accept(lexer, Token.Kind.RBRACE)) return new JsonObject(m);
            while (true) {
                if (lexer.current().kind() != Token.Kind.STRING) throw unexpected(lexer, "string key");
                String key = lexer.current().text();
                lexer.advance();
                expect(lexer, Token.Kind.COLON);
                m.put(key, parseValue(lexer, depth));
                if (accept(lexer, Token.Kind.COMMA)) continue;
                if (accept(lexer, Token.Kind.RBRACE)) break;
                throw unexpected(lexer, "',' or '}'");
            }
            return new JsonObject(m);
        }

        JsonArray parseArray(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            lexer.advance(); // [
            List<JsonValue> list = new ArrayList<>();
            if (accept(lexer, Token.Kind.RBRACKET)) return new JsonArray(list);
            while (true) {
                list.add(parseValue(lexer, depth));
                if (accept(lexer, Token.Kind.COMMA)) continue;
                if (accept(lexer, Token.Kind.RBRACKET)) break;
                throw unexpected(lexer, "',' or ']'");
            }
            return new JsonArray(list);
        }

        private void checkDepth(Lexer lexer, int depth) {
            if (depth > maxDepth) error(lexer, Kind.DEPTH_EXCEEDED, "Maximum nesting depth " + maxDepth + " exceeded");
        }

        static void expect(Lexer lexer, Token.Kind kind) {
            if (lexer.current().kind() != kind) throw unexpected(lexer, kind.description());
            lexer.advance();
        }

        static boolean accept(Lexer lexer, Token.Kind kind) {
            if (lexer.current().kind() == kind) {
                lexer.advance();
                return true;
            }
            return false;
        }

        static SyntaxException unexpected(Lexer lexer, String expected) {
            Token found = lexer.current();
            if (found.kind() == Token.Kind.EOF)
                return error(lexer, Kind.UNEXPECTED_END_OF_INPUT, "Unexpected end of input: expected " + expected);
            return error(lexer, Kind.UNEXPECTED_TOKEN, "Unexpected token: expected " + expected + ", found " + describe(found));
        }

        static SyntaxException error(Lexer lexer, Kind kind, String msg) {
            throw new SyntaxException(kind, msg, lexer.current().position(), lexer.line(), lexer.col());
        }

        static String describe(Token token) {
            return switch (token.kind()) {
                case STRING -> "string \"" + token.text() + "\"";
                case NUMBER -> "number " + token.text();
                default -> token.kind().description();
            };
        }
    }
}
