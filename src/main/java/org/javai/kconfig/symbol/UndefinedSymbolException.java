package org.javai.kconfig.symbol;

import org.javai.kconfig.KconfigLoadException;
import org.javai.kconfig.ast.Entry;

/**
 * Thrown at build time when an expression, {@code select} or {@code imply} names a symbol
 * that no {@code config} in the resolved tree defines.
 */
public class UndefinedSymbolException extends KconfigLoadException {

	private final String symbolId;
	private final String referencedBy;

	public UndefinedSymbolException(String symbolId, String referencedBy, Entry.Location location) {
		super("Undefined symbol '" + symbolId + "' referenced by '" + referencedBy + "'"
				+ (location != null ? " at " + location : ""));
		this.symbolId = symbolId;
		this.referencedBy = referencedBy;
	}

	public String symbolId() {
		return symbolId;
	}

	public String referencedBy() {
		return referencedBy;
	}
}
