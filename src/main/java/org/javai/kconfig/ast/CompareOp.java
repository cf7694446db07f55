package org.javai.kconfig.ast;

/**
 * Comparison operators usable between two expression atoms.
 */
public enum CompareOp {
	EQUAL("="),
	UNEQUAL("!="),
	LESS("<"),
	LESS_EQUAL("<="),
	GREATER(">"),
	GREATER_EQUAL(">=");

	private final String symbol;

	CompareOp(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	/**
	 * Interprets the sign of a {@code compareTo} result.
	 */
	public boolean test(int comparison) {
		return switch (this) {
			case EQUAL -> comparison == 0;
			case UNEQUAL -> comparison != 0;
			case LESS -> comparison < 0;
			case LESS_EQUAL -> comparison <= 0;
			case GREATER -> comparison > 0;
			case GREATER_EQUAL -> comparison >= 0;
		};
	}
}
