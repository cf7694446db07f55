package org.javai.kconfig.symbol;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.SymbolKind;
import org.javai.kconfig.eval.ExpressionEvaluator;
import org.javai.kconfig.eval.Tristate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single write path into a {@link SymbolTable}.
 * <p>
 * Each {@link #set} request is checked against the table as it stands before the request
 * (dependencies when raising a value, choice exclusivity when setting {@code y}, active
 * selects when lowering). A request that fails a check is rejected with a
 * {@link ResolutionError} and changes nothing. An accepted request commits the value, then
 * raises every symbol reachable over active {@code select} edges, and reports imply
 * suggestions and orphaned selections without applying them.
 * <p>
 * After every accepted request, including a lowering one, each symbol is raised to the
 * level its active selectors force. Lowering a symbol can therefore raise others, for
 * example the target of {@code select X if !C} when {@code C} is turned off. Nothing but
 * the requested symbol is ever lowered.
 * <p>
 * Post-condition of every call: values read from the table before the call may be stale
 * and must be re-read. Calls hold the table's monitor for their whole duration, so every
 * resolver over one table shares a single exclusive section.
 */
public final class DependencyResolver {

	private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

	private final SymbolTable table;

	public DependencyResolver(SymbolTable table) {
		this.table = Objects.requireNonNull(table, "table must not be null");
	}

	public SymbolTable table() {
		return table;
	}

	public SetResult set(String id, Tristate value) {
		Objects.requireNonNull(value, "value must not be null");
		return set(id, value.token());
	}

	/**
	 * Requests a new value for a symbol.
	 * <p>
	 * Setting a symbol to the value it already holds is a no-op with no effects.
	 *
	 * @param id the symbol id
	 * @param requested {@code y}/{@code m}/{@code n} (any case) for bool and tristate, text
	 * for string, a decimal integer for int, a hexadecimal integer for hex
	 */
	public SetResult set(String id, String requested) {
		Objects.requireNonNull(id, "id must not be null");
		synchronized (table) {
			return apply(id, requested);
		}
	}

	private SetResult apply(String id, String requested) {
		Symbol symbol = table.symbol(id).orElse(null);
		if (symbol == null) {
			return reject(new ResolutionError.UndefinedSymbol(id));
		}
		String value = canonical(symbol.kind(), requested);
		if (value == null) {
			return reject(new ResolutionError.InvalidValue(id, symbol.kind(), requested));
		}
		if (value.equals(symbol.value())) {
			logger.debug("{} already holds {}", id, value);
			return new SetResult.Applied(id, value, Effects.none());
		}

		Tristate before = symbol.tristate();
		Tristate after = ExpressionEvaluator.coerce(symbol.kind(), value);
		int direction = after.compareTo(before);

		List<String> orphaned = List.of();
		if (direction > 0) {
			ResolutionError error = checkRaise(symbol, after);
			if (error != null) {
				return reject(error);
			}
		}
		else if (direction < 0) {
			List<String> blocking = blockingSelectors(id, after);
			if (!blocking.isEmpty()) {
				return reject(new ResolutionError.SelectedBy(id, blocking));
			}
			if (after == Tristate.N) {
				orphaned = orphanedSelections(id);
			}
		}

		table.assign(id, value, ValueOrigin.USER);

		List<String> cascaded = new ArrayList<>();
		if (direction > 0) {
			Set<String> visited = new HashSet<>();
			visited.add(id);
			cascade(id, visited, cascaded);
		}
		settleSelects(cascaded);
		List<ImplySuggestion> suggestions = direction > 0 ? implySuggestions(id) : List.of();

		logger.debug("Set {}={} (cascaded: {}, suggested: {}, orphaned: {})", id, value, cascaded, suggestions.size(),
				orphaned);
		return new SetResult.Applied(id, value, new Effects(cascaded, suggestions, orphaned));
	}

	private ResolutionError checkRaise(Symbol symbol, Tristate after) {
		Tristate required = symbol.kind() == SymbolKind.TRISTATE && after == Tristate.Y ? Tristate.Y : Tristate.M;
		Expr dependsOn = table.dependsOn(symbol.id());
		if (!table.evaluate(dependsOn).isAtLeast(required)) {
			return new ResolutionError.DependencyUnmet(symbol.id(), dependsOn,
					ExpressionEvaluator.unmetSymbols(dependsOn, table, required));
		}
		if (after == Tristate.Y) {
			ChoiceGroup group = table.choiceOf(symbol.id()).orElse(null);
			if (group != null) {
				for (String member : group.members()) {
					if (!member.equals(symbol.id()) && table.tristate(member) == Tristate.Y) {
						return new ResolutionError.ChoiceExclusivityViolation(symbol.id(), group.name(), member);
					}
				}
			}
		}
		return null;
	}

	/**
	 * Selectors that currently force {@code id} above {@code target}.
	 */
	private List<String> blockingSelectors(String id, Tristate target) {
		List<String> blocking = new ArrayList<>();
		for (String selector : table.selectors(id)) {
			for (SymbolEdge edge : table.selects(selector)) {
				if (edge.target().equals(id) && table.selectStrength(selector, edge).compareTo(target) > 0) {
					blocking.add(selector);
					break;
				}
			}
		}
		return blocking;
	}

	/**
	 * Depth-first walk of active select edges from {@code source}. A symbol already visited
	 * in this walk is not entered again, which ends the walk on cyclic select graphs.
	 */
	private void cascade(String source, Set<String> visited, List<String> cascaded) {
		for (SymbolEdge edge : table.selects(source)) {
			Tristate strength = table.selectStrength(source, edge);
			if (!strength.isEnabled() || !visited.add(edge.target())) {
				continue;
			}
			raise(edge.target(), strength, cascaded);
			cascade(edge.target(), visited, cascaded);
		}
	}

	/**
	 * Raises every symbol below the level its active selectors force, until nothing
	 * changes. Values only increase, so this terminates.
	 */
	private void settleSelects(List<String> cascaded) {
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Symbol selector : table.symbols()) {
				if (!selector.tristate().isEnabled()) {
					continue;
				}
				for (SymbolEdge edge : table.selects(selector.id())) {
					changed |= raise(edge.target(), table.selectStrength(selector.id(), edge), cascaded);
				}
			}
		}
	}

	private boolean raise(String id, Tristate strength, List<String> cascaded) {
		if (table.tristate(id).compareTo(strength) >= 0) {
			return false;
		}
		table.assign(id, strength.token(), ValueOrigin.SELECT);
		if (!cascaded.contains(id)) {
			cascaded.add(id);
		}
		return true;
	}

	private List<ImplySuggestion> implySuggestions(String id) {
		List<ImplySuggestion> suggestions = new ArrayList<>();
		Tristate source = table.tristate(id);
		for (SymbolEdge edge : table.implies(id)) {
			Tristate strength = source.and(table.evaluate(edge.condition()));
			Symbol target = table.symbol(edge.target()).orElseThrow();
			if (strength == Tristate.M && target.kind() == SymbolKind.BOOL) {
				strength = Tristate.Y;
			}
			if (strength.isEnabled() && target.tristate().compareTo(strength) < 0) {
				suggestions.add(new ImplySuggestion(target.id(), strength, id));
			}
		}
		return suggestions;
	}

	/**
	 * Symbols enabled only by selects reachable from {@code id}: every active selector of
	 * each result is {@code id} or another result.
	 */
	private List<String> orphanedSelections(String id) {
		Set<String> reachable = new LinkedHashSet<>();
		collectReachable(id, reachable);

		Set<String> candidates = new LinkedHashSet<>();
		for (String target : reachable) {
			Symbol symbol = table.symbol(target).orElseThrow();
			if (!target.equals(id) && symbol.origin() == ValueOrigin.SELECT && symbol.tristate().isEnabled()) {
				candidates.add(target);
			}
		}

		boolean changed = true;
		while (changed) {
			changed = false;
			for (String candidate : new ArrayList<>(candidates)) {
				for (String selector : table.activeSelectors(candidate)) {
					if (!selector.equals(id) && !candidates.contains(selector)) {
						candidates.remove(candidate);
						changed = true;
						break;
					}
				}
			}
		}
		return new ArrayList<>(candidates);
	}

	private void collectReachable(String source, Set<String> reachable) {
		for (SymbolEdge edge : table.selects(source)) {
			if (table.selectStrength(source, edge).isEnabled() && reachable.add(edge.target())) {
				collectReachable(edge.target(), reachable);
			}
		}
	}

	private SetResult reject(ResolutionError error) {
		logger.debug("Rejected change to {}: {}", error.symbolId(), error.message());
		return new SetResult.Rejected(error);
	}

	/**
	 * Canonical form of a requested value, or {@code null} if it is malformed for the kind.
	 */
	static String canonical(SymbolKind kind, String requested) {
		if (requested == null) {
			return null;
		}
		return switch (kind) {
			case BOOL -> Tristate.fromToken(requested)
					.filter(t -> t != Tristate.M)
					.map(Tristate::token)
					.orElse(null);
			case TRISTATE -> Tristate.fromToken(requested).map(Tristate::token).orElse(null);
			case STRING -> requested;
			case INT -> {
				Long parsed = ExpressionEvaluator.parseDecimal(requested);
				yield parsed != null ? Long.toString(parsed) : null;
			}
			case HEX -> {
				Long parsed = ExpressionEvaluator.parseHex(requested);
				yield parsed != null ? "0x" + Long.toHexString(parsed) : null;
			}
		};
	}
}
