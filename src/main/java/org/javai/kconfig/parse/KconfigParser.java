package org.javai.kconfig.parse;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.javai.kconfig.ast.CompareOp;
import org.javai.kconfig.ast.Entry;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.KconfigFile;
import org.javai.kconfig.ast.SymbolKind;

/**
 * Recursive-descent parser for Kconfig files with one token of lookahead.
 * <p>
 * Block directives must be closed by their own terminator; a missing or mismatched
 * terminator, an unknown directive, or a property that does not belong to its directive
 * is a fatal {@link KconfigParseException}. {@code source} directives are kept as
 * {@link Entry.Source} entries for the source resolver to expand.
 * <p>
 * Example usage:
 *
 * <pre>
 * KconfigFile file = KconfigParser.parse(text, "Kconfig");
 * </pre>
 */
public class KconfigParser {

	private static final Pattern DECIMAL = Pattern.compile("-?[0-9]+");
	private static final Pattern HEXADECIMAL = Pattern.compile("0[xX][0-9a-fA-F]+");

	private static final Map<String, String> TERMINATORS = Map.of(
			"endmenu", "menu",
			"endchoice", "choice",
			"endif", "if");

	private static final Map<KconfigToken.TokenType, CompareOp> COMPARISONS = Map.of(
			KconfigToken.TokenType.EQUAL, CompareOp.EQUAL,
			KconfigToken.TokenType.UNEQUAL, CompareOp.UNEQUAL,
			KconfigToken.TokenType.LESS, CompareOp.LESS,
			KconfigToken.TokenType.LESS_EQUAL, CompareOp.LESS_EQUAL,
			KconfigToken.TokenType.GREATER, CompareOp.GREATER,
			KconfigToken.TokenType.GREATER_EQUAL, CompareOp.GREATER_EQUAL);

	/**
	 * Properties that may follow a directive line.
	 */
	private enum Property {
		TYPE, DEF_TYPE, PROMPT, DEFAULT, DEPENDS, SELECT, IMPLY, RANGE, HELP, OPTIONAL, VISIBLE;

		static Property of(String word) {
			return switch (word) {
				case "bool", "boolean", "tristate", "string", "int", "hex" -> TYPE;
				case "def_bool", "def_tristate" -> DEF_TYPE;
				case "prompt" -> PROMPT;
				case "default" -> DEFAULT;
				case "depends" -> DEPENDS;
				case "select" -> SELECT;
				case "imply" -> IMPLY;
				case "range" -> RANGE;
				case "help", "---help---" -> HELP;
				case "optional" -> OPTIONAL;
				case "visible" -> VISIBLE;
				default -> null;
			};
		}
	}

	private static final Set<Property> CONFIG_PROPERTIES = EnumSet.of(Property.TYPE, Property.DEF_TYPE,
			Property.PROMPT, Property.DEFAULT, Property.DEPENDS, Property.SELECT, Property.IMPLY, Property.RANGE,
			Property.HELP);
	private static final Set<Property> CHOICE_PROPERTIES = EnumSet.of(Property.TYPE, Property.PROMPT,
			Property.DEFAULT, Property.DEPENDS, Property.OPTIONAL, Property.HELP);
	private static final Set<Property> MENU_PROPERTIES = EnumSet.of(Property.DEPENDS, Property.VISIBLE);
	private static final Set<Property> COMMENT_PROPERTIES = EnumSet.of(Property.DEPENDS);

	private final List<KconfigToken> tokens;
	private final String file;
	private int current = 0;
	private String mainMenu;

	public KconfigParser(List<KconfigToken> tokens, String file) {
		this.tokens = tokens != null ? tokens : List.of();
		this.file = file != null ? file : "<input>";
	}

	/**
	 * Tokenizes and parses a complete file.
	 *
	 * @throws KconfigParseException on any lexical or syntax error
	 */
	public static KconfigFile parse(String text, String file) {
		List<KconfigToken> tokens = new KconfigTokenizer(text, file).tokenize();
		return new KconfigParser(tokens, file).parse();
	}

	public KconfigFile parse() {
		List<Entry> entries = parseEntries(null);
		return new KconfigFile(mainMenu, entries);
	}

	private record OpenBlock(String keyword, int line) {
	}

	private List<Entry> parseEntries(OpenBlock block) {
		List<Entry> entries = new ArrayList<>();
		while (true) {
			skipEols();
			KconfigToken token = peek();
			if (token.isType(KconfigToken.TokenType.EOF)) {
				if (block != null) {
					throw new KconfigParseException(file, block.line(), block.keyword(),
							"Unterminated '" + block.keyword() + "' block: expected 'end" + block.keyword() + "'");
				}
				return entries;
			}
			if (token.isType(KconfigToken.TokenType.WORD) && TERMINATORS.containsKey(token.value())) {
				String opens = TERMINATORS.get(token.value());
				if (block == null) {
					throw error("Unexpected '" + token.value() + "' without matching '" + opens + "'", token);
				}
				if (!opens.equals(block.keyword())) {
					throw error("Mismatched '" + token.value() + "': expected 'end" + block.keyword()
							+ "' to close '" + block.keyword() + "' opened at line " + block.line(), token);
				}
				advance();
				expectEol();
				return entries;
			}
			Entry entry = parseEntry();
			if (entry != null) {
				entries.add(entry);
			}
		}
	}

	private Entry parseEntry() {
		KconfigToken token = peek();
		if (!token.isType(KconfigToken.TokenType.WORD)) {
			throw error("Expected a directive", token);
		}
		return switch (token.value()) {
			case "config" -> parseConfig(false);
			case "menuconfig" -> parseConfig(true);
			case "menu" -> parseMenu();
			case "choice" -> parseChoice();
			case "if" -> parseIf();
			case "source" -> parseSource();
			case "comment" -> parseComment();
			case "mainmenu" -> {
				parseMainMenu();
				yield null;
			}
			default -> throw error("Unknown directive '" + token.value() + "'", token);
		};
	}

	private Entry parseConfig(boolean menuconfig) {
		KconfigToken keyword = advance();
		String name = expectWord("symbol name after '" + keyword.value() + "'");
		expectEol();

		Properties props = parseProperties(keyword.value(), CONFIG_PROPERTIES);
		return new Entry.Config(name, menuconfig, props.kind, props.prompt, props.defaults, props.dependsOn,
				props.selects, props.implies, props.ranges, props.help, location(keyword));
	}

	private Entry parseMenu() {
		KconfigToken keyword = advance();
		String title = expectString("menu title");
		expectEol();

		Properties props = parseProperties("menu", MENU_PROPERTIES);
		List<Entry> children = parseEntries(new OpenBlock("menu", keyword.line()));
		return new Entry.Menu(title, props.dependsOn, props.visibleIf, children, location(keyword));
	}

	private Entry parseChoice() {
		KconfigToken keyword = advance();
		String name = null;
		if (peek().isType(KconfigToken.TokenType.WORD)) {
			name = advance().value();
		}
		expectEol();

		Properties props = parseProperties("choice", CHOICE_PROPERTIES);
		List<Entry> children = parseEntries(new OpenBlock("choice", keyword.line()));
		return new Entry.Choice(name, props.kind, props.prompt, props.defaults, props.dependsOn, props.optional,
				props.help, children, location(keyword));
	}

	private Entry parseIf() {
		KconfigToken keyword = advance();
		Expr condition = parseExpression();
		expectEol();

		List<Entry> children = parseEntries(new OpenBlock("if", keyword.line()));
		return new Entry.If(condition, children, location(keyword));
	}

	private Entry parseSource() {
		KconfigToken keyword = advance();
		KconfigToken path = peek();
		if (!path.isType(KconfigToken.TokenType.STRING) && !path.isType(KconfigToken.TokenType.WORD)) {
			throw error("Expected file path after 'source'", path);
		}
		advance();
		expectEol();
		return new Entry.Source(path.value(), location(keyword));
	}

	private Entry parseComment() {
		KconfigToken keyword = advance();
		String text = expectString("comment text");
		expectEol();

		Properties props = parseProperties("comment", COMMENT_PROPERTIES);
		return new Entry.Comment(text, props.dependsOn, location(keyword));
	}

	private void parseMainMenu() {
		KconfigToken keyword = advance();
		String title = expectString("main menu title");
		expectEol();
		if (mainMenu != null) {
			throw error("Duplicate 'mainmenu'", keyword);
		}
		mainMenu = title;
	}

	/**
	 * Mutable accumulator for the property lines following a directive.
	 */
	private static final class Properties {
		SymbolKind kind;
		Entry.Prompt prompt;
		final List<Entry.DefaultClause> defaults = new ArrayList<>();
		final List<Expr> dependsOn = new ArrayList<>();
		final List<Entry.ReverseDependency> selects = new ArrayList<>();
		final List<Entry.ReverseDependency> implies = new ArrayList<>();
		final List<Entry.RangeClause> ranges = new ArrayList<>();
		String help;
		boolean optional;
		Expr visibleIf;
	}

	private Properties parseProperties(String directive, Set<Property> allowed) {
		Properties props = new Properties();
		while (true) {
			skipEols();
			KconfigToken token = peek();
			if (!token.isType(KconfigToken.TokenType.WORD)) {
				return props;
			}
			Property property = Property.of(token.value());
			if (property == null) {
				return props;
			}
			if (!allowed.contains(property)) {
				throw error("'" + token.value() + "' is not valid in '" + directive + "'", token);
			}
			advance();
			switch (property) {
				case TYPE -> {
					setKind(props, token);
					if (peek().isType(KconfigToken.TokenType.STRING)) {
						props.prompt = parsePromptTail();
					}
					else {
						expectEol();
					}
				}
				case DEF_TYPE -> {
					setKind(props, token);
					Expr value = parseExpression();
					props.defaults.add(new Entry.DefaultClause(value, parseOptionalCondition()));
				}
				case PROMPT -> props.prompt = parsePromptTail();
				case DEFAULT -> {
					Expr value = parseExpression();
					props.defaults.add(new Entry.DefaultClause(value, parseOptionalCondition()));
				}
				case DEPENDS -> {
					KconfigToken on = advance();
					if (!on.isWord("on")) {
						throw error("Expected 'on' after 'depends'", on);
					}
					props.dependsOn.add(parseExpression());
					expectEol();
				}
				case SELECT -> {
					String target = expectWord("symbol name after 'select'");
					props.selects.add(new Entry.ReverseDependency(target, parseOptionalCondition()));
				}
				case IMPLY -> {
					String target = expectWord("symbol name after 'imply'");
					props.implies.add(new Entry.ReverseDependency(target, parseOptionalCondition()));
				}
				case RANGE -> {
					Expr low = parseAtom();
					Expr high = parseAtom();
					props.ranges.add(new Entry.RangeClause(low, high, parseOptionalCondition()));
				}
				case HELP -> {
					expectEol();
					KconfigToken text = advance();
					if (!text.isType(KconfigToken.TokenType.HELP_TEXT)) {
						throw error("Expected help text", text);
					}
					props.help = text.value();
				}
				case OPTIONAL -> {
					props.optional = true;
					expectEol();
				}
				case VISIBLE -> {
					KconfigToken ifToken = advance();
					if (!ifToken.isWord("if")) {
						throw error("Expected 'if' after 'visible'", ifToken);
					}
					props.visibleIf = Expr.and(props.visibleIf, parseExpression());
					expectEol();
				}
			}
		}
	}

	private void setKind(Properties props, KconfigToken token) {
		String keyword = switch (token.value()) {
			case "def_bool" -> "bool";
			case "def_tristate" -> "tristate";
			default -> token.value();
		};
		SymbolKind kind = SymbolKind.fromKeyword(keyword)
				.orElseThrow(() -> error("Unknown type '" + token.value() + "'", token));
		if (props.kind != null && props.kind != kind) {
			throw error("Conflicting type '" + token.value() + "', already declared as '"
					+ props.kind.keyword() + "'", token);
		}
		props.kind = kind;
	}

	private Entry.Prompt parsePromptTail() {
		String text = expectString("prompt text");
		return new Entry.Prompt(text, parseOptionalCondition());
	}

	/**
	 * Parses an optional {@code if <expr>} suffix and the end of line.
	 */
	private Expr parseOptionalCondition() {
		Expr condition = null;
		if (peek().isWord("if")) {
			advance();
			condition = parseExpression();
		}
		expectEol();
		return condition;
	}

	// Expressions, loosest binding first: ||, &&, !, comparison, atom.

	Expr parseExpression() {
		return parseOr();
	}

	private Expr parseOr() {
		Expr left = parseAnd();
		while (peek().isType(KconfigToken.TokenType.OR)) {
			advance();
			left = new Expr.Or(left, parseAnd());
		}
		return left;
	}

	private Expr parseAnd() {
		Expr left = parseNot();
		while (peek().isType(KconfigToken.TokenType.AND)) {
			advance();
			left = new Expr.And(left, parseNot());
		}
		return left;
	}

	private Expr parseNot() {
		if (peek().isType(KconfigToken.TokenType.NOT)) {
			advance();
			return new Expr.Not(parseNot());
		}
		return parsePrimary();
	}

	private Expr parsePrimary() {
		if (peek().isType(KconfigToken.TokenType.LPAREN)) {
			KconfigToken open = advance();
			Expr inner = parseExpression();
			if (!peek().isType(KconfigToken.TokenType.RPAREN)) {
				throw error("Expected ')' to close '(' on line " + open.line(), peek());
			}
			advance();
			return inner;
		}
		Expr atom = parseAtom();
		CompareOp op = COMPARISONS.get(peek().type());
		if (op != null) {
			advance();
			return new Expr.Compare(op, atom, parseAtom());
		}
		return atom;
	}

	private Expr parseAtom() {
		KconfigToken token = peek();
		if (token.isType(KconfigToken.TokenType.STRING)) {
			advance();
			return new Expr.Literal(token.value(), true);
		}
		if (token.isType(KconfigToken.TokenType.WORD)) {
			advance();
			return isConstantWord(token.value()) ? Expr.literal(token.value()) : Expr.symbol(token.value());
		}
		throw error("Expected symbol or constant", token);
	}

	private static boolean isConstantWord(String word) {
		String lower = word.toLowerCase(Locale.ROOT);
		return lower.equals("y") || lower.equals("m") || lower.equals("n")
				|| DECIMAL.matcher(word).matches() || HEXADECIMAL.matcher(word).matches();
	}

	private String expectWord(String what) {
		KconfigToken token = peek();
		if (!token.isType(KconfigToken.TokenType.WORD)) {
			throw error("Expected " + what, token);
		}
		advance();
		return token.value();
	}

	private String expectString(String what) {
		KconfigToken token = peek();
		if (!token.isType(KconfigToken.TokenType.STRING)) {
			throw error("Expected quoted " + what, token);
		}
		advance();
		return token.value();
	}

	private void expectEol() {
		KconfigToken token = peek();
		if (token.isType(KconfigToken.TokenType.EOF)) {
			return;
		}
		if (!token.isType(KconfigToken.TokenType.EOL)) {
			throw error("Unexpected token", token);
		}
		advance();
	}

	private void skipEols() {
		while (peek().isType(KconfigToken.TokenType.EOL)) {
			advance();
		}
	}

	private Entry.Location location(KconfigToken token) {
		return new Entry.Location(file, token.line());
	}

	private KconfigParseException error(String message, KconfigToken token) {
		return new KconfigParseException(file, token.line(), token.describe(), message);
	}

	private KconfigToken peek() {
		if (current >= tokens.size()) {
			int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
			return new KconfigToken(KconfigToken.TokenType.EOF, "", line);
		}
		return tokens.get(current);
	}

	private KconfigToken advance() {
		KconfigToken token = peek();
		if (current < tokens.size() && !token.isType(KconfigToken.TokenType.EOF)) {
			current++;
		}
		return token;
	}
}
