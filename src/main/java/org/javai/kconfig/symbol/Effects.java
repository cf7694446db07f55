package org.javai.kconfig.symbol;

import java.util.List;

/**
 * Side effects of one accepted {@link DependencyResolver#set} request.
 *
 * @param cascaded symbols raised by select cascades, in the order they changed
 * @param suggestions imply suggestions for the caller to accept or ignore
 * @param orphanedSelections symbols that were enabled only through the disabled symbol's
 * selects and are no longer required by anything else. Advisory: they keep their value.
 */
public record Effects(List<String> cascaded, List<ImplySuggestion> suggestions, List<String> orphanedSelections) {

	private static final Effects NONE = new Effects(List.of(), List.of(), List.of());

	public Effects {
		cascaded = cascaded != null ? List.copyOf(cascaded) : List.of();
		suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
		orphanedSelections = orphanedSelections != null ? List.copyOf(orphanedSelections) : List.of();
	}

	public static Effects none() {
		return NONE;
	}

	public boolean isEmpty() {
		return cascaded.isEmpty() && suggestions.isEmpty() && orphanedSelections.isEmpty();
	}
}
