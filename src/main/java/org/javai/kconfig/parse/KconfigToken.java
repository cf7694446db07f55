package org.javai.kconfig.parse;

/**
 * Represents a token in Kconfig source text.
 *
 * @param type the token type
 * @param value the token value (text content; unquoted for strings)
 * @param line the 1-based line the token starts on
 */
public record KconfigToken(TokenType type, String value, int line) {

	public enum TokenType {
		WORD,          // keywords, symbol ids, numbers
		STRING,        // "quoted" or 'quoted'
		AND,           // &&
		OR,            // ||
		NOT,           // !
		EQUAL,         // =
		UNEQUAL,       // !=
		LESS,          // <
		LESS_EQUAL,    // <=
		GREATER,       // >
		GREATER_EQUAL, // >=
		LPAREN,        // (
		RPAREN,        // )
		HELP_TEXT,     // block following a help keyword
		EOL,           // end of logical line
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case WORD -> "WORD(" + value + ")";
			case HELP_TEXT -> "HELP_TEXT";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isWord(String expected) {
		return type == TokenType.WORD && value.equals(expected);
	}

	/**
	 * Text used to point at this token in error messages.
	 */
	public String describe() {
		return switch (type) {
			case EOL -> "end of line";
			case EOF -> "end of file";
			case HELP_TEXT -> "help text";
			default -> value;
		};
	}
}
