package org.javai.kconfig.eval;

import java.util.Locale;
import java.util.Optional;

/**
 * Three-valued logic domain ordered {@code n < m < y}.
 */
public enum Tristate {
	N("n"),
	M("m"),
	Y("y");

	private final String token;

	Tristate(String token) {
		this.token = token;
	}

	/**
	 * The lower-case token used in Kconfig and config files.
	 */
	public String token() {
		return token;
	}

	/**
	 * Parses {@code y}, {@code m} or {@code n}, case-insensitively.
	 */
	public static Optional<Tristate> fromToken(String text) {
		if (text == null) {
			return Optional.empty();
		}
		return switch (text.trim().toLowerCase(Locale.ROOT)) {
			case "y" -> Optional.of(Y);
			case "m" -> Optional.of(M);
			case "n" -> Optional.of(N);
			default -> Optional.empty();
		};
	}

	public static Tristate of(boolean value) {
		return value ? Y : N;
	}

	public Tristate and(Tristate other) {
		return compareTo(other) <= 0 ? this : other;
	}

	public Tristate or(Tristate other) {
		return compareTo(other) >= 0 ? this : other;
	}

	/**
	 * {@code y} and {@code n} swap; {@code m} stays {@code m}.
	 */
	public Tristate not() {
		return switch (this) {
			case Y -> N;
			case M -> M;
			case N -> Y;
		};
	}

	public boolean isAtLeast(Tristate other) {
		return compareTo(other) >= 0;
	}

	public boolean isEnabled() {
		return this != N;
	}

	@Override
	public String toString() {
		return token;
	}
}
