package org.javai.kconfig.symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.SymbolKind;
import org.javai.kconfig.eval.ExpressionEvaluator;
import org.javai.kconfig.eval.SymbolValues;
import org.javai.kconfig.eval.Tristate;

/**
 * The authoritative registry of symbols and their dependency maps.
 * <p>
 * Built once by {@link SymbolTableBuilder} and afterwards mutated only through
 * {@link DependencyResolver#set}. Every consumer reads through this table; symbols
 * returned from it are live views, so a caller never needs (and must not keep) a copy of
 * values across a {@code set()} call. Re-parsing produces a new table rather than
 * updating this one.
 */
public final class SymbolTable implements SymbolValues {

	private final Map<String, Symbol> symbols;
	private final Map<String, Expr> dependsMap;
	private final Map<String, List<SymbolEdge>> selectMap;
	private final Map<String, List<SymbolEdge>> implyMap;
	private final Map<String, List<String>> reverseSelectMap;
	private final Map<String, ChoiceGroup> choices;
	private final Map<String, ChoiceGroup> choiceByMember;
	private final String mainMenu;

	SymbolTable(Map<String, Symbol> symbols, Map<String, Expr> dependsMap, Map<String, List<SymbolEdge>> selectMap,
			Map<String, List<SymbolEdge>> implyMap, Map<String, List<String>> reverseSelectMap,
			Map<String, ChoiceGroup> choices, String mainMenu) {
		this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
		this.dependsMap = Map.copyOf(dependsMap);
		this.selectMap = Map.copyOf(selectMap);
		this.implyMap = Map.copyOf(implyMap);
		this.reverseSelectMap = Map.copyOf(reverseSelectMap);
		this.choices = Collections.unmodifiableMap(new LinkedHashMap<>(choices));
		Map<String, ChoiceGroup> byMember = new LinkedHashMap<>();
		for (ChoiceGroup group : choices.values()) {
			for (String member : group.members()) {
				byMember.put(member, group);
			}
		}
		this.choiceByMember = Collections.unmodifiableMap(byMember);
		this.mainMenu = mainMenu;
	}

	public Optional<Symbol> symbol(String id) {
		return Optional.ofNullable(symbols.get(id));
	}

	public boolean contains(String id) {
		return symbols.containsKey(id);
	}

	/**
	 * All symbols in definition order.
	 */
	public Collection<Symbol> symbols() {
		return symbols.values();
	}

	public int size() {
		return symbols.size();
	}

	/**
	 * The dependency expression of a symbol, {@code null} when it has none.
	 */
	public Expr dependsOn(String id) {
		return dependsMap.get(id);
	}

	/**
	 * Symbols force-enabled by {@code id} when it is enabled.
	 */
	public List<SymbolEdge> selects(String id) {
		return selectMap.getOrDefault(id, List.of());
	}

	/**
	 * Symbols suggested by {@code id} when it is enabled.
	 */
	public List<SymbolEdge> implies(String id) {
		return implyMap.getOrDefault(id, List.of());
	}

	/**
	 * Symbols that {@code select} the given id, regardless of guards.
	 */
	public List<String> selectors(String id) {
		return reverseSelectMap.getOrDefault(id, List.of());
	}

	public Optional<ChoiceGroup> choiceOf(String id) {
		return Optional.ofNullable(choiceByMember.get(id));
	}

	public Optional<ChoiceGroup> choice(String name) {
		return Optional.ofNullable(choices.get(name));
	}

	public Collection<ChoiceGroup> choices() {
		return choices.values();
	}

	/**
	 * The {@code mainmenu} title, {@code null} if the tree declares none.
	 */
	public String mainMenu() {
		return mainMenu;
	}

	/**
	 * Current value of a defined symbol, coerced to the tristate domain.
	 *
	 * @throws IllegalArgumentException if the symbol is undefined
	 */
	public Tristate tristate(String id) {
		Symbol symbol = symbols.get(id);
		if (symbol == null) {
			throw new IllegalArgumentException("Undefined symbol: " + id);
		}
		return symbol.tristate();
	}

	/**
	 * Evaluates an expression against the current values.
	 */
	public Tristate evaluate(Expr expr) {
		return ExpressionEvaluator.evaluate(expr, this);
	}

	/**
	 * Whether a symbol would currently be shown to the user: it has a prompt, and the
	 * prompt condition and its dependencies both evaluate to at least {@code m}.
	 */
	public boolean isVisible(String id) {
		Symbol symbol = symbols.get(id);
		return symbol != null && symbol.hasPrompt()
				&& evaluate(symbol.promptCondition()).isEnabled()
				&& evaluate(symbol.dependsOn()).isEnabled();
	}

	/**
	 * Strength with which {@code selector} currently forces the target of {@code edge}:
	 * the selector's value limited by the edge's guard. A bool target forced to {@code m}
	 * is promoted to {@code y}.
	 */
	public Tristate selectStrength(String selector, SymbolEdge edge) {
		Tristate strength = tristate(selector).and(evaluate(edge.condition()));
		Symbol target = symbols.get(edge.target());
		if (strength == Tristate.M && target != null && target.kind() == SymbolKind.BOOL) {
			return Tristate.Y;
		}
		return strength;
	}

	/**
	 * The lowest value {@code id} may currently hold given every active select on it.
	 */
	public Tristate forcedLevel(String id) {
		Tristate level = Tristate.N;
		for (String selector : selectors(id)) {
			for (SymbolEdge edge : selects(selector)) {
				if (edge.target().equals(id)) {
					level = level.or(selectStrength(selector, edge));
				}
			}
		}
		return level;
	}

	/**
	 * Enabled selectors whose guard on the select edge to {@code id} currently holds.
	 */
	public List<String> activeSelectors(String id) {
		List<String> active = new ArrayList<>();
		for (String selector : selectors(id)) {
			for (SymbolEdge edge : selects(selector)) {
				if (edge.target().equals(id) && selectStrength(selector, edge).isEnabled()) {
					active.add(selector);
					break;
				}
			}
		}
		return active;
	}

	/**
	 * A copy of all current values, id to raw value, in definition order. Intended for
	 * persisting or comparing state; it is not updated by later changes.
	 */
	public Map<String, String> values() {
		Map<String, String> values = new LinkedHashMap<>();
		for (Symbol symbol : symbols.values()) {
			values.put(symbol.id(), symbol.value());
		}
		return values;
	}

	@Override
	public Optional<SymbolKind> kindOf(String id) {
		return symbol(id).map(Symbol::kind);
	}

	@Override
	public Optional<String> valueOf(String id) {
		return symbol(id).map(Symbol::value);
	}

	void assign(String id, String value, ValueOrigin origin) {
		Symbol symbol = symbols.get(id);
		if (symbol == null) {
			throw new IllegalStateException("Assignment to undefined symbol: " + id);
		}
		symbol.assign(value, origin);
	}
}
