package org.javai.kconfig.symbol;

import java.util.Objects;
import org.javai.kconfig.ast.Expr;

/**
 * A {@code select} or {@code imply} edge from a source symbol to {@code target}.
 *
 * @param target the symbol being selected or implied
 * @param condition the trailing {@code if} guard, {@code null} when unconditional
 */
public record SymbolEdge(String target, Expr condition) {

	public SymbolEdge {
		Objects.requireNonNull(target, "target must not be null");
	}
}
