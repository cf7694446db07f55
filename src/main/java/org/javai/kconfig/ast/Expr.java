package org.javai.kconfig.ast;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Expression AST used by {@code depends on}, {@code default}, {@code if} guards and
 * select/imply conditions. Sealed: the grammar is closed and evaluators dispatch over
 * exactly these variants.
 * <p>
 * {@link #toString()} renders each node back into Kconfig syntax so that expressions can
 * be quoted verbatim in diagnostics.
 */
public sealed interface Expr {

	/**
	 * Reference to a configuration symbol by id.
	 */
	record SymbolRef(String name) implements Expr {
		public SymbolRef {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * A constant: a tristate token, a number or a quoted string.
	 *
	 * @param value the literal text, without quotes
	 * @param quoted whether the literal was written as a quoted string
	 */
	record Literal(String value, boolean quoted) implements Expr {
		public Literal {
			Objects.requireNonNull(value, "value must not be null");
		}

		/**
		 * True when the literal is one of the constants y, m, n (in any case), quoted or not.
		 */
		public boolean isTristateToken() {
			String lower = value.toLowerCase(Locale.ROOT);
			return lower.equals("y") || lower.equals("m") || lower.equals("n");
		}

		@Override
		public String toString() {
			return quoted ? "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"" : value;
		}
	}

	record And(Expr left, Expr right) implements Expr {
		public And {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public String toString() {
			return wrap(left, this) + " && " + wrap(right, this);
		}
	}

	record Or(Expr left, Expr right) implements Expr {
		public Or {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public String toString() {
			return wrap(left, this) + " || " + wrap(right, this);
		}
	}

	record Not(Expr operand) implements Expr {
		public Not {
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public String toString() {
			return "!" + wrap(operand, this);
		}
	}

	/**
	 * Comparison between two atoms. The result is always {@code y} or {@code n}.
	 */
	record Compare(CompareOp op, Expr left, Expr right) implements Expr {
		public Compare {
			Objects.requireNonNull(op, "op must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public String toString() {
			return left + " " + op.symbol() + " " + right;
		}
	}

	static Expr symbol(String name) {
		return new SymbolRef(name);
	}

	static Expr literal(String value) {
		return new Literal(value, false);
	}

	/**
	 * Conjunction that treats {@code null} as "always true".
	 */
	static Expr and(Expr left, Expr right) {
		if (left == null) {
			return right;
		}
		if (right == null) {
			return left;
		}
		return new And(left, right);
	}

	/**
	 * All symbol ids referenced anywhere inside the expression, in first-seen order.
	 */
	static Set<String> referencedSymbols(Expr expr) {
		Set<String> names = new LinkedHashSet<>();
		collectSymbols(expr, names);
		return names;
	}

	private static void collectSymbols(Expr expr, Set<String> names) {
		if (expr == null) {
			return;
		}
		if (expr instanceof SymbolRef ref) {
			names.add(ref.name());
		}
		else if (expr instanceof And and) {
			collectSymbols(and.left(), names);
			collectSymbols(and.right(), names);
		}
		else if (expr instanceof Or or) {
			collectSymbols(or.left(), names);
			collectSymbols(or.right(), names);
		}
		else if (expr instanceof Not not) {
			collectSymbols(not.operand(), names);
		}
		else if (expr instanceof Compare compare) {
			collectSymbols(compare.left(), names);
			collectSymbols(compare.right(), names);
		}
	}

	private static int precedence(Expr expr) {
		if (expr instanceof Or) {
			return 1;
		}
		if (expr instanceof And) {
			return 2;
		}
		if (expr instanceof Not) {
			return 3;
		}
		return 4;
	}

	private static String wrap(Expr child, Expr parent) {
		return precedence(child) < precedence(parent) ? "(" + child + ")" : child.toString();
	}
}
