package jsonengine;

/**
 * A lexical unit of JSON text.
 *
 * @param kind     token kind
 * @param text     decoded contents for {@link Kind#STRING}, the raw lexeme for {@link Kind#NUMBER},
 *                 the literal source text otherwise (empty for {@link Kind#EOF})
 * @param position 0-based character offset of the token's first character
 * @author Freeman
 * @since 0.1.0
 */
public record Token(Kind kind, String text, int position) {

    public enum Kind {
        LBRACE("'{'"),
        RBRACE("'}'"),
        LBRACKET("'['"),
        RBRACKET("']'"),
        COLON("':'"),
        COMMA("','"),
        STRING("string"),
        NUMBER("number"),
        TRUE("'true'"),
        FALSE("'false'"),
        NULL("'null'"),
        EOF("end of input");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        /**
         * @return how the kind reads in an error message
         */
        public String description() {
            return description;
        }
    }
}
