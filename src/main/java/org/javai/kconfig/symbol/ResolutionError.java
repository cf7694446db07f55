package org.javai.kconfig.symbol;

import java.util.List;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.SymbolKind;

/**
 * Why a {@link DependencyResolver#set} request was rejected. A rejected request leaves
 * the symbol table exactly as it was.
 */
public sealed interface ResolutionError {

	String symbolId();

	/**
	 * A human-readable description suitable for a status line or dialog.
	 */
	String message();

	/**
	 * The symbol's dependencies do not allow the requested value.
	 *
	 * @param unmetExpression the full dependency expression
	 * @param unmetSymbols the symbol references that currently hold the expression down
	 */
	record DependencyUnmet(String symbolId, Expr unmetExpression, List<String> unmetSymbols)
			implements ResolutionError {
		public DependencyUnmet {
			unmetSymbols = unmetSymbols != null ? List.copyOf(unmetSymbols) : List.of();
		}

		@Override
		public String message() {
			return symbolId + " depends on " + unmetExpression + "; not satisfied: " + String.join(", ", unmetSymbols);
		}
	}

	/**
	 * The symbol cannot be lowered while enabled symbols select it.
	 */
	record SelectedBy(String symbolId, List<String> blockingSymbols) implements ResolutionError {
		public SelectedBy {
			blockingSymbols = blockingSymbols != null ? List.copyOf(blockingSymbols) : List.of();
		}

		@Override
		public String message() {
			return symbolId + " is selected by " + String.join(", ", blockingSymbols);
		}
	}

	record UndefinedSymbol(String symbolId) implements ResolutionError {
		@Override
		public String message() {
			return "Undefined symbol " + symbolId;
		}
	}

	/**
	 * Another member of the same choice group already holds {@code y}.
	 */
	record ChoiceExclusivityViolation(String symbolId, String choice, String selectedMember)
			implements ResolutionError {
		@Override
		public String message() {
			return symbolId + " cannot be set to y: " + selectedMember + " is already selected in choice " + choice;
		}
	}

	/**
	 * The requested value is not well-formed for the symbol's kind.
	 */
	record InvalidValue(String symbolId, SymbolKind kind, String value) implements ResolutionError {
		@Override
		public String message() {
			return "'" + value + "' is not a valid " + kind.keyword() + " value for " + symbolId;
		}
	}
}
