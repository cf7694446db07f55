package org.javai.kconfig.symbol;

/**
 * Outcome of a {@link DependencyResolver#set} request.
 */
public sealed interface SetResult {

	/**
	 * The value was committed. Any view of the table taken before the call is stale.
	 *
	 * @param value the committed value in canonical form
	 */
	record Applied(String symbolId, String value, Effects effects) implements SetResult {
	}

	/**
	 * Nothing was changed.
	 */
	record Rejected(ResolutionError error) implements SetResult {
	}

	default boolean isApplied() {
		return this instanceof Applied;
	}
}
