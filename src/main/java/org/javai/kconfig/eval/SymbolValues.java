package org.javai.kconfig.eval;

import java.util.Optional;
import org.javai.kconfig.ast.SymbolKind;

/**
 * Read access to current symbol values, as needed by {@link ExpressionEvaluator}.
 */
public interface SymbolValues {

	/**
	 * The kind of the symbol, or empty if no such symbol is defined.
	 */
	Optional<SymbolKind> kindOf(String id);

	/**
	 * The raw current value of the symbol, or empty if no such symbol is defined.
	 */
	Optional<String> valueOf(String id);
}
