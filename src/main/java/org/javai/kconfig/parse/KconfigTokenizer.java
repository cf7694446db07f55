package org.javai.kconfig.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented tokenizer for Kconfig source text.
 * <p>
 * End of line is significant and produces an {@link KconfigToken.TokenType#EOL} token.
 * A backslash immediately before a newline joins the two lines, and {@code #} starts a
 * comment that runs to the end of the line. A {@code help} keyword at the start of a line
 * switches to help-text mode: the indented block that follows is returned verbatim as a
 * single {@link KconfigToken.TokenType#HELP_TEXT} token.
 */
public class KconfigTokenizer {

	private static final int TAB_WIDTH = 8;

	private final String input;
	private final String file;
	private int pos = 0;
	private int line = 1;

	public KconfigTokenizer(String input) {
		this(input, "<input>");
	}

	public KconfigTokenizer(String input, String file) {
		this.input = input != null ? input : "";
		this.file = file != null ? file : "<input>";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (ends with EOL, if any token was produced, and EOF)
	 * @throws KconfigParseException if invalid syntax is encountered
	 */
	public List<KconfigToken> tokenize() {
		List<KconfigToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipBlanks();
			if (isAtEnd()) break;

			if (peek() == '\n') {
				tokens.add(new KconfigToken(KconfigToken.TokenType.EOL, "\n", line));
				advance();
				continue;
			}

			boolean startOfLine = tokens.isEmpty() || tokens.get(tokens.size() - 1).isType(KconfigToken.TokenType.EOL)
					|| tokens.get(tokens.size() - 1).isType(KconfigToken.TokenType.HELP_TEXT);
			KconfigToken token = nextToken();
			tokens.add(token);

			if (startOfLine && isHelpKeyword(token)) {
				finishHelpLine(token, tokens);
				tokens.add(scanHelpText());
			}
		}

		if (!tokens.isEmpty() && !tokens.get(tokens.size() - 1).isType(KconfigToken.TokenType.EOL)) {
			tokens.add(new KconfigToken(KconfigToken.TokenType.EOL, "\n", line));
		}
		tokens.add(new KconfigToken(KconfigToken.TokenType.EOF, "", line));
		return tokens;
	}

	private KconfigToken nextToken() {
		int startLine = line;
		char c = peek();

		return switch (c) {
			case '"', '\'' -> scanString(c);
			case '(' -> {
				advance();
				yield new KconfigToken(KconfigToken.TokenType.LPAREN, "(", startLine);
			}
			case ')' -> {
				advance();
				yield new KconfigToken(KconfigToken.TokenType.RPAREN, ")", startLine);
			}
			case '=' -> {
				advance();
				yield new KconfigToken(KconfigToken.TokenType.EQUAL, "=", startLine);
			}
			case '!' -> {
				advance();
				if (match('=')) {
					yield new KconfigToken(KconfigToken.TokenType.UNEQUAL, "!=", startLine);
				}
				yield new KconfigToken(KconfigToken.TokenType.NOT, "!", startLine);
			}
			case '<' -> {
				advance();
				if (match('=')) {
					yield new KconfigToken(KconfigToken.TokenType.LESS_EQUAL, "<=", startLine);
				}
				yield new KconfigToken(KconfigToken.TokenType.LESS, "<", startLine);
			}
			case '>' -> {
				advance();
				if (match('=')) {
					yield new KconfigToken(KconfigToken.TokenType.GREATER_EQUAL, ">=", startLine);
				}
				yield new KconfigToken(KconfigToken.TokenType.GREATER, ">", startLine);
			}
			case '&' -> {
				advance();
				if (!match('&')) {
					throw error("Expected '&&'", "&");
				}
				yield new KconfigToken(KconfigToken.TokenType.AND, "&&", startLine);
			}
			case '|' -> {
				advance();
				if (!match('|')) {
					throw error("Expected '||'", "|");
				}
				yield new KconfigToken(KconfigToken.TokenType.OR, "||", startLine);
			}
			default -> {
				if (isWordChar(c)) {
					yield scanWord();
				}
				throw error("Unexpected character", String.valueOf(c));
			}
		};
	}

	private KconfigToken scanString(char quote) {
		int startLine = line;
		advance(); // consume opening quote

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != quote && peek() != '\n') {
			char c = advance();
			if (c == '\\' && !isAtEnd() && peek() != '\n') {
				sb.append(advance());
			}
			else {
				sb.append(c);
			}
		}

		if (isAtEnd() || peek() == '\n') {
			throw new KconfigParseException(file, startLine, quote + sb.toString(), "Unterminated string");
		}

		advance(); // consume closing quote
		return new KconfigToken(KconfigToken.TokenType.STRING, sb.toString(), startLine);
	}

	private KconfigToken scanWord() {
		int start = pos;
		while (!isAtEnd() && isWordChar(peek())) {
			advance();
		}
		return new KconfigToken(KconfigToken.TokenType.WORD, input.substring(start, pos), line);
	}

	private boolean isHelpKeyword(KconfigToken token) {
		return token.isWord("help") || token.isWord("---help---");
	}

	private void finishHelpLine(KconfigToken helpToken, List<KconfigToken> tokens) {
		skipBlanks();
		if (isAtEnd()) {
			return;
		}
		if (peek() != '\n') {
			throw error("Unexpected text after '" + helpToken.value() + "'", restOfLine());
		}
		tokens.add(new KconfigToken(KconfigToken.TokenType.EOL, "\n", line));
		advance();
	}

	/**
	 * Reads the help block: blank lines and lines indented at least as deep as the first
	 * non-blank line. That first line's indentation is stripped from every line.
	 */
	private KconfigToken scanHelpText() {
		int startLine = line;
		List<String> lines = new ArrayList<>();
		int indent = -1;

		while (!isAtEnd()) {
			int lineEnd = input.indexOf('\n', pos);
			if (lineEnd < 0) {
				lineEnd = input.length();
			}
			String text = input.substring(pos, lineEnd);
			if (text.endsWith("\r")) {
				text = text.substring(0, text.length() - 1);
			}

			if (!text.isBlank()) {
				int width = indentWidth(text);
				if (indent < 0) {
					if (width == 0) break;
					indent = width;
				}
				else if (width < indent) {
					break;
				}
				lines.add(stripIndent(text, indent));
			}
			else {
				lines.add("");
			}
			consumeThrough(lineEnd);
		}

		while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
			lines.remove(lines.size() - 1);
		}
		while (!lines.isEmpty() && lines.get(0).isEmpty()) {
			lines.remove(0);
		}
		return new KconfigToken(KconfigToken.TokenType.HELP_TEXT, String.join("\n", lines), startLine);
	}

	private void consumeThrough(int lineEnd) {
		while (pos < lineEnd) {
			advance();
		}
		if (!isAtEnd()) {
			advance(); // newline
		}
	}

	private static int indentWidth(String text) {
		int column = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == ' ') {
				column++;
			}
			else if (c == '\t') {
				column = (column / TAB_WIDTH + 1) * TAB_WIDTH;
			}
			else {
				break;
			}
		}
		return column;
	}

	private static String stripIndent(String text, int indent) {
		int column = 0;
		int i = 0;
		while (i < text.length() && column < indent) {
			char c = text.charAt(i);
			if (c == ' ') {
				column++;
			}
			else if (c == '\t') {
				column = (column / TAB_WIDTH + 1) * TAB_WIDTH;
			}
			else {
				break;
			}
			i++;
		}
		String overshoot = column > indent ? " ".repeat(column - indent) : "";
		return overshoot + text.substring(i);
	}

	/**
	 * Skips spaces, tabs, carriage returns, comments and line continuations.
	 */
	private void skipBlanks() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r') {
				advance();
			}
			else if (c == '\\' && isContinuation()) {
				while (peek() != '\n') {
					advance();
				}
				advance();
			}
			else if (c == '#') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			}
			else {
				break;
			}
		}
	}

	private boolean isContinuation() {
		int next = pos + 1;
		if (next < input.length() && input.charAt(next) == '\r') {
			next++;
		}
		return next < input.length() && input.charAt(next) == '\n';
	}

	private String restOfLine() {
		int end = input.indexOf('\n', pos);
		return input.substring(pos, end < 0 ? input.length() : end).trim();
	}

	private KconfigParseException error(String message, String near) {
		return new KconfigParseException(file, line, near, message);
	}

	private boolean match(char expected) {
		if (!isAtEnd() && peek() == expected) {
			advance();
			return true;
		}
		return false;
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static boolean isWordChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
				|| c == '_' || c == '-' || c == '.' || c == '/' || c == '$';
	}
}
