package org.javai.kconfig.symbol;

import org.javai.kconfig.eval.Tristate;

/**
 * A value suggested by an {@code imply}. Never applied by the engine; the caller decides
 * whether to issue a {@link DependencyResolver#set} for it.
 *
 * @param symbolId the implied symbol
 * @param value the suggested value
 * @param impliedBy the symbol whose enabling produced the suggestion
 */
public record ImplySuggestion(String symbolId, Tristate value, String impliedBy) {
}
