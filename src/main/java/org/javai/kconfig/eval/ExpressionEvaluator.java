package org.javai.kconfig.eval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.SymbolKind;

/**
 * Evaluates {@link Expr} trees against current symbol values.
 * <p>
 * Evaluation is pure: it never mutates the values it reads and is total over expressions
 * whose symbol references are all defined. A reference to an undefined symbol is an
 * internal error ({@link EvaluationException}).
 * <p>
 * A {@code null} expression stands for an absent condition and evaluates to {@code y}.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {
		// Utility class - no instantiation
	}

	/**
	 * Evaluates an expression in the tristate domain.
	 */
	public static Tristate evaluate(Expr expr, SymbolValues symbols) {
		Objects.requireNonNull(symbols, "symbols must not be null");
		if (expr == null) {
			return Tristate.Y;
		}
		if (expr instanceof Expr.SymbolRef ref) {
			return coerce(kindOf(ref, symbols), valueOf(ref, symbols));
		}
		if (expr instanceof Expr.Literal literal) {
			return literal.isTristateToken() ? Tristate.fromToken(literal.value()).orElseThrow() : Tristate.N;
		}
		if (expr instanceof Expr.And and) {
			return evaluate(and.left(), symbols).and(evaluate(and.right(), symbols));
		}
		if (expr instanceof Expr.Or or) {
			return evaluate(or.left(), symbols).or(evaluate(or.right(), symbols));
		}
		if (expr instanceof Expr.Not not) {
			return evaluate(not.operand(), symbols).not();
		}
		if (expr instanceof Expr.Compare compare) {
			Operand left = operand(compare.left(), symbols);
			Operand right = operand(compare.right(), symbols);
			return Tristate.of(compare.op().test(compareOperands(left, right)));
		}
		throw new EvaluationException("Unsupported expression node: " + expr.getClass().getSimpleName());
	}

	/**
	 * Evaluates an expression as a raw value, used for string, int and hex defaults.
	 * Atoms yield their text; compound expressions yield their tristate token.
	 */
	public static String evaluateValue(Expr expr, SymbolValues symbols) {
		Objects.requireNonNull(expr, "expr must not be null");
		if (expr instanceof Expr.SymbolRef ref) {
			return valueOf(ref, symbols);
		}
		if (expr instanceof Expr.Literal literal) {
			return literal.value();
		}
		return evaluate(expr, symbols).token();
	}

	/**
	 * Maps a raw symbol value to the tristate domain. bool and tristate values are read as
	 * tokens; string values are {@code y} when non-empty; int and hex values are {@code y}
	 * when non-zero.
	 */
	public static Tristate coerce(SymbolKind kind, String value) {
		if (value == null) {
			return Tristate.N;
		}
		return switch (kind) {
			case BOOL, TRISTATE -> Tristate.fromToken(value).orElse(Tristate.N);
			case STRING -> Tristate.of(!value.isEmpty());
			case INT -> Tristate.of(parseDecimal(value) != null && parseDecimal(value) != 0L);
			case HEX -> Tristate.of(parseHex(value) != null && parseHex(value) != 0L);
		};
	}

	/**
	 * Reports which symbol references make {@code expr} evaluate below {@code required}.
	 * <p>
	 * The walk follows negation: under a {@code !}, a reference is reported when it is
	 * currently enabled. Comparisons that fail report every symbol they reference.
	 *
	 * @return symbol ids in the order they appear in the expression; empty if the
	 * expression already meets the threshold
	 */
	public static List<String> unmetSymbols(Expr expr, SymbolValues symbols, Tristate required) {
		Set<String> unmet = new LinkedHashSet<>();
		collectUnmet(expr, symbols, required, true, unmet);
		return new ArrayList<>(unmet);
	}

	private static void collectUnmet(Expr expr, SymbolValues symbols, Tristate required, boolean positive,
			Set<String> unmet) {
		if (expr == null) {
			return;
		}
		Tristate value = evaluate(expr, symbols);
		Tristate effective = positive ? value : value.not();
		if (effective.isAtLeast(required)) {
			return;
		}
		if (expr instanceof Expr.SymbolRef ref) {
			unmet.add(ref.name());
		}
		else if (expr instanceof Expr.And and) {
			collectUnmet(and.left(), symbols, required, positive, unmet);
			collectUnmet(and.right(), symbols, required, positive, unmet);
		}
		else if (expr instanceof Expr.Or or) {
			collectUnmet(or.left(), symbols, required, positive, unmet);
			collectUnmet(or.right(), symbols, required, positive, unmet);
		}
		else if (expr instanceof Expr.Not not) {
			collectUnmet(not.operand(), symbols, required, !positive, unmet);
		}
		else if (expr instanceof Expr.Compare compare) {
			unmet.addAll(Expr.referencedSymbols(compare));
		}
	}

	/**
	 * A comparison operand: its raw text and, for symbol references, the symbol kind.
	 */
	private record Operand(String text, SymbolKind kind) {
	}

	private static Operand operand(Expr expr, SymbolValues symbols) {
		if (expr instanceof Expr.SymbolRef ref) {
			return new Operand(valueOf(ref, symbols), kindOf(ref, symbols));
		}
		if (expr instanceof Expr.Literal literal) {
			return new Operand(literal.value(), null);
		}
		return new Operand(evaluate(expr, symbols).token(), SymbolKind.TRISTATE);
	}

	private static int compareOperands(Operand left, Operand right) {
		boolean tristateContext = (left.kind() != null && left.kind().isBoolean())
				|| (right.kind() != null && right.kind().isBoolean())
				|| (left.kind() == null && right.kind() == null && isTristateText(left.text())
						&& isTristateText(right.text()));
		if (tristateContext) {
			Tristate l = Tristate.fromToken(left.text()).orElse(null);
			Tristate r = Tristate.fromToken(right.text()).orElse(null);
			if (l != null && r != null) {
				return l.compareTo(r);
			}
		}

		Long l = parseNumber(left);
		Long r = parseNumber(right);
		if (l != null && r != null) {
			return Long.compare(l, r);
		}
		return left.text().compareTo(right.text());
	}

	private static Long parseNumber(Operand operand) {
		if (operand.kind() == SymbolKind.HEX) {
			return parseHex(operand.text());
		}
		if (operand.kind() == SymbolKind.INT) {
			return parseDecimal(operand.text());
		}
		if (operand.kind() != null) {
			return null;
		}
		String text = operand.text();
		return text.startsWith("0x") || text.startsWith("0X") ? parseHex(text) : parseDecimal(text);
	}

	private static boolean isTristateText(String text) {
		String lower = text.toLowerCase(Locale.ROOT);
		return lower.equals("y") || lower.equals("m") || lower.equals("n");
	}

	/**
	 * Parses a decimal integer, returning {@code null} if the text is not one.
	 */
	public static Long parseDecimal(String text) {
		if (text == null || text.isBlank()) {
			return null;
		}
		try {
			return Long.parseLong(text.trim());
		}
		catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * Parses a hexadecimal integer with optional {@code 0x} prefix, returning {@code null}
	 * if the text is not one.
	 */
	public static Long parseHex(String text) {
		if (text == null || text.isBlank()) {
			return null;
		}
		String digits = text.trim();
		if (digits.startsWith("0x") || digits.startsWith("0X")) {
			digits = digits.substring(2);
		}
		if (digits.isEmpty()) {
			return null;
		}
		try {
			return Long.parseUnsignedLong(digits, 16);
		}
		catch (NumberFormatException e) {
			return null;
		}
	}

	private static SymbolKind kindOf(Expr.SymbolRef ref, SymbolValues symbols) {
		return symbols.kindOf(ref.name())
				.orElseThrow(() -> new EvaluationException("Reference to undefined symbol: " + ref.name()));
	}

	private static String valueOf(Expr.SymbolRef ref, SymbolValues symbols) {
		return symbols.valueOf(ref.name())
				.orElseThrow(() -> new EvaluationException("Reference to undefined symbol: " + ref.name()));
	}
}
