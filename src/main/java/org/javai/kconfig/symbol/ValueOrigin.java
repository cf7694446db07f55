package org.javai.kconfig.symbol;

/**
 * Where a symbol's current value came from.
 */
public enum ValueOrigin {
	/** Computed from {@code default} clauses when the table was built. */
	DEFAULT,
	/** Requested explicitly through {@link DependencyResolver#set}. */
	USER,
	/** Forced on by a {@code select} from another enabled symbol. */
	SELECT
}
