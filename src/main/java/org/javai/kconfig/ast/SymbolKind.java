package org.javai.kconfig.ast;

import java.util.Optional;

/**
 * The value type of a configuration symbol.
 */
public enum SymbolKind {
	BOOL("bool"),
	TRISTATE("tristate"),
	STRING("string"),
	INT("int"),
	HEX("hex");

	private final String keyword;

	SymbolKind(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	/**
	 * True for kinds whose value lives in the tristate domain.
	 */
	public boolean isBoolean() {
		return this == BOOL || this == TRISTATE;
	}

	public boolean isNumeric() {
		return this == INT || this == HEX;
	}

	/**
	 * Maps a type keyword to its kind. {@code boolean} is accepted as an alias for {@code bool}.
	 */
	public static Optional<SymbolKind> fromKeyword(String keyword) {
		if ("boolean".equals(keyword)) {
			return Optional.of(BOOL);
		}
		for (SymbolKind kind : values()) {
			if (kind.keyword.equals(keyword)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
