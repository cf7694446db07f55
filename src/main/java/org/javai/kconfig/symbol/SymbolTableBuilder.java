package org.javai.kconfig.symbol;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.kconfig.KconfigLoadException;
import org.javai.kconfig.ast.Entry;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.KconfigFile;
import org.javai.kconfig.ast.SymbolKind;
import org.javai.kconfig.eval.ExpressionEvaluator;
import org.javai.kconfig.eval.Tristate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SymbolTable} from a resolved Kconfig tree in a single pass.
 * <p>
 * Each symbol's dependency expression is the conjunction of every enclosing {@code if} and
 * {@code menu}/{@code choice} dependency and its own {@code depends on} clauses. After
 * collection, every referenced id is checked to be defined, and initial values are
 * computed from defaults, choice selections and selects until they settle. The table is
 * only returned once complete.
 */
public final class SymbolTableBuilder {

	private static final Logger logger = LoggerFactory.getLogger(SymbolTableBuilder.class);

	private boolean strictSelectCycles;

	/**
	 * When enabled, a cycle in the combined select/imply graph is a load error instead of
	 * being cut off during cascades.
	 */
	public SymbolTableBuilder strictSelectCycles(boolean strict) {
		this.strictSelectCycles = strict;
		return this;
	}

	/**
	 * @throws UndefinedSymbolException if any reference names an undefined symbol
	 * @throws KconfigLoadException on duplicate definitions, missing types, invalid
	 * select/imply targets, or (in strict mode) select/imply cycles
	 */
	public SymbolTable build(KconfigFile file) {
		Objects.requireNonNull(file, "file must not be null");
		Collector collector = new Collector();
		collector.walk(file.entries(), null, null, null);

		validateReferences(collector);

		Map<String, Expr> dependsMap = new HashMap<>();
		Map<String, List<SymbolEdge>> selectMap = new HashMap<>();
		Map<String, List<SymbolEdge>> implyMap = new HashMap<>();
		Map<String, List<String>> reverseSelectMap = new HashMap<>();
		for (Symbol symbol : collector.symbols.values()) {
			if (symbol.dependsOn() != null) {
				dependsMap.put(symbol.id(), symbol.dependsOn());
			}
			if (!symbol.selects().isEmpty()) {
				selectMap.put(symbol.id(), symbol.selects());
			}
			if (!symbol.implies().isEmpty()) {
				implyMap.put(symbol.id(), symbol.implies());
			}
			for (SymbolEdge edge : symbol.selects()) {
				List<String> selectors = reverseSelectMap.computeIfAbsent(edge.target(), k -> new ArrayList<>());
				if (!selectors.contains(symbol.id())) {
					selectors.add(symbol.id());
				}
			}
		}
		reverseSelectMap.replaceAll((k, v) -> List.copyOf(v));

		if (strictSelectCycles) {
			detectCycles(collector.symbols);
		}

		SymbolTable table = new SymbolTable(collector.symbols, dependsMap, selectMap, implyMap, reverseSelectMap,
				collector.choices, file.mainMenu());
		computeInitialValues(table);
		logger.info("Built symbol table: {} symbols, {} choice groups", table.size(), table.choices().size());
		return table;
	}

	/**
	 * Walks the entry tree, carrying the enclosing guard, visibility and choice group.
	 */
	private static final class Collector {

		final Map<String, Symbol> symbols = new LinkedHashMap<>();
		final Map<String, ChoiceGroup> choices = new LinkedHashMap<>();

		void walk(List<Entry> entries, Expr guard, Expr visible, List<String> choiceMembers) {
			for (Entry entry : entries) {
				if (entry instanceof Entry.Config config) {
					addSymbol(config, guard, visible, choiceMembers);
				}
				else if (entry instanceof Entry.Menu menu) {
					walk(menu.entries(), conjunction(guard, menu.dependsOn()), Expr.and(visible, menu.visibleIf()),
							null);
				}
				else if (entry instanceof Entry.Choice choice) {
					addChoice(choice, guard, visible);
				}
				else if (entry instanceof Entry.If block) {
					walk(block.entries(), Expr.and(guard, block.condition()), visible, choiceMembers);
				}
				else if (entry instanceof Entry.Source source) {
					throw new IllegalStateException("Unresolved source directive '" + source.path() + "' at "
							+ source.location());
				}
				// comments carry no symbol state
			}
		}

		private void addSymbol(Entry.Config config, Expr guard, Expr visible, List<String> choiceMembers) {
			Symbol existing = symbols.get(config.name());
			if (existing != null) {
				throw new KconfigLoadException("Symbol '" + config.name() + "' defined at " + existing.location()
						+ " is redefined at " + config.location());
			}
			if (config.kind() == null) {
				throw new KconfigLoadException("Symbol '" + config.name() + "' at " + config.location()
						+ " has no type");
			}
			Entry.Prompt prompt = config.prompt();
			Symbol symbol = new Symbol(
					config.name(),
					config.kind(),
					prompt != null ? prompt.text() : null,
					Expr.and(visible, prompt != null ? prompt.condition() : null),
					config.defaults(),
					conjunction(guard, config.dependsOn()),
					edges(config.selects()),
					edges(config.implies()),
					config.help(),
					null,
					config.menuconfig(),
					config.location());
			if (choiceMembers != null) {
				if (!config.kind().isBoolean()) {
					throw new KconfigLoadException("Choice member '" + config.name() + "' at " + config.location()
							+ " must be bool or tristate");
				}
				choiceMembers.add(config.name());
			}
			symbols.put(config.name(), symbol);
		}

		private void addChoice(Entry.Choice choice, Expr guard, Expr visible) {
			String name = choice.name() != null ? choice.name() : "<choice@" + choice.location() + ">";
			if (choices.containsKey(name)) {
				throw new KconfigLoadException("Choice '" + name + "' at " + choice.location() + " is redefined");
			}
			Expr dependsOn = conjunction(guard, choice.dependsOn());
			List<String> members = new ArrayList<>();
			walk(choice.entries(), dependsOn, visible, members);

			SymbolKind kind = choice.kind() != null ? choice.kind() : SymbolKind.BOOL;
			if (!kind.isBoolean()) {
				throw new KconfigLoadException("Choice '" + name + "' at " + choice.location()
						+ " must be bool or tristate");
			}
			for (String member : members) {
				Symbol symbol = symbols.get(member);
				symbols.put(member, new Symbol(symbol.id(), symbol.kind(), symbol.prompt(), symbol.promptCondition(),
						symbol.defaults(), symbol.dependsOn(), symbol.selects(), symbol.implies(), symbol.help(), name,
						symbol.isMenuconfig(), symbol.location()));
			}
			choices.put(name, new ChoiceGroup(name, choice.prompt() != null ? choice.prompt().text() : null, kind,
					members, choice.optional(), choice.defaults(), dependsOn, choice.location()));
		}

		private static Expr conjunction(Expr guard, List<Expr> clauses) {
			Expr result = guard;
			for (Expr clause : clauses) {
				result = Expr.and(result, clause);
			}
			return result;
		}

		private static List<SymbolEdge> edges(List<Entry.ReverseDependency> clauses) {
			List<SymbolEdge> edges = new ArrayList<>(clauses.size());
			for (Entry.ReverseDependency clause : clauses) {
				edges.add(new SymbolEdge(clause.target(), clause.condition()));
			}
			return edges;
		}
	}

	private void validateReferences(Collector collector) {
		Map<String, Symbol> symbols = collector.symbols;
		for (Symbol symbol : symbols.values()) {
			requireDefined(symbols, symbol.dependsOn(), symbol);
			requireDefined(symbols, symbol.promptCondition(), symbol);
			for (Entry.DefaultClause clause : symbol.defaults()) {
				requireDefined(symbols, clause.value(), symbol);
				requireDefined(symbols, clause.condition(), symbol);
			}
			for (SymbolEdge edge : symbol.selects()) {
				Symbol target = requireTarget(symbols, edge, symbol, "select");
				if (target.choice() != null) {
					throw new KconfigLoadException("'" + symbol.id() + "' at " + symbol.location()
							+ " selects choice member '" + target.id() + "'");
				}
			}
			for (SymbolEdge edge : symbol.implies()) {
				requireTarget(symbols, edge, symbol, "imply");
			}
		}
		for (ChoiceGroup group : collector.choices.values()) {
			for (Entry.DefaultClause clause : group.defaults()) {
				requireDefined(symbols, clause.condition(), group.name(), group.location());
				if (!(clause.value() instanceof Expr.SymbolRef ref) || !group.contains(ref.name())) {
					throw new KconfigLoadException("Default '" + clause.value() + "' of choice '" + group.name()
							+ "' at " + group.location() + " is not a member of the choice");
				}
			}
		}
	}

	private static Symbol requireTarget(Map<String, Symbol> symbols, SymbolEdge edge, Symbol source, String relation) {
		Symbol target = symbols.get(edge.target());
		if (target == null) {
			throw new UndefinedSymbolException(edge.target(), source.id(), source.location());
		}
		if (!target.kind().isBoolean()) {
			throw new KconfigLoadException("'" + source.id() + "' at " + source.location() + " cannot " + relation
					+ " " + target.kind().keyword() + " symbol '" + target.id() + "'");
		}
		requireDefined(symbols, edge.condition(), source);
		return target;
	}

	private static void requireDefined(Map<String, Symbol> symbols, Expr expr, Symbol owner) {
		requireDefined(symbols, expr, owner.id(), owner.location());
	}

	private static void requireDefined(Map<String, Symbol> symbols, Expr expr, String owner, Entry.Location location) {
		for (String name : Expr.referencedSymbols(expr)) {
			if (!symbols.containsKey(name)) {
				throw new UndefinedSymbolException(name, owner, location);
			}
		}
	}

	private static void detectCycles(Map<String, Symbol> symbols) {
		Set<String> done = new HashSet<>();
		for (String id : symbols.keySet()) {
			visit(id, symbols, new ArrayList<>(), done);
		}
	}

	private static void visit(String id, Map<String, Symbol> symbols, List<String> path, Set<String> done) {
		int index = path.indexOf(id);
		if (index >= 0) {
			List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
			cycle.add(id);
			throw new KconfigLoadException("Select/imply cycle detected: " + String.join(" -> ", cycle));
		}
		if (done.contains(id)) {
			return;
		}
		path.add(id);
		Symbol symbol = symbols.get(id);
		for (SymbolEdge edge : symbol.selects()) {
			visit(edge.target(), symbols, path, done);
		}
		for (SymbolEdge edge : symbol.implies()) {
			visit(edge.target(), symbols, path, done);
		}
		path.remove(path.size() - 1);
		done.add(id);
	}

	/**
	 * Repeats default evaluation until no value changes. Selects raise values; choices pick
	 * one member. Values only depend on the table, so a settled pass is a fixed point.
	 */
	private void computeInitialValues(SymbolTable table) {
		int maxPasses = table.size() + 2;
		for (int pass = 0; pass < maxPasses; pass++) {
			boolean changed = false;
			for (Symbol symbol : table.symbols()) {
				if (symbol.choice() == null) {
					changed |= applyDefault(table, symbol);
				}
			}
			for (ChoiceGroup group : table.choices()) {
				changed |= applyChoice(table, group);
			}
			if (!changed) {
				return;
			}
		}
		logger.warn("Default values did not settle after {} passes; keeping last computed values", maxPasses);
	}

	private boolean applyDefault(SymbolTable table, Symbol symbol) {
		String value;
		ValueOrigin origin = ValueOrigin.DEFAULT;
		if (symbol.kind().isBoolean()) {
			Tristate computed = defaultTristate(table, symbol);
			Tristate forced = table.forcedLevel(symbol.id());
			if (forced.compareTo(computed) > 0) {
				computed = forced;
				origin = ValueOrigin.SELECT;
			}
			value = computed.token();
		}
		else {
			value = defaultText(table, symbol);
		}
		if (value.equals(symbol.value()) && origin == symbol.origin()) {
			return false;
		}
		table.assign(symbol.id(), value, origin);
		return true;
	}

	private static Tristate defaultTristate(SymbolTable table, Symbol symbol) {
		Tristate dependency = table.evaluate(symbol.dependsOn());
		Tristate value = Tristate.N;
		for (Entry.DefaultClause clause : symbol.defaults()) {
			Tristate condition = table.evaluate(clause.condition());
			if (condition.isEnabled()) {
				value = table.evaluate(clause.value()).and(condition);
				break;
			}
		}
		value = value.and(dependency);
		if (symbol.kind() == SymbolKind.BOOL && value == Tristate.M) {
			value = Tristate.Y;
		}
		return value;
	}

	private static String defaultText(SymbolTable table, Symbol symbol) {
		String fallback = Symbol.emptyValue(symbol.kind());
		if (!table.evaluate(symbol.dependsOn()).isEnabled()) {
			return fallback;
		}
		for (Entry.DefaultClause clause : symbol.defaults()) {
			if (table.evaluate(clause.condition()).isEnabled()) {
				String value = ExpressionEvaluator.evaluateValue(clause.value(), table);
				if (!isWellFormed(symbol.kind(), value)) {
					logger.warn("Ignoring malformed default '{}' for {} symbol {}", value, symbol.kind().keyword(),
							symbol.id());
					return fallback;
				}
				return value;
			}
		}
		return fallback;
	}

	private static boolean applyChoice(SymbolTable table, ChoiceGroup group) {
		String selected = null;
		if (table.evaluate(group.dependsOn()).isEnabled()) {
			for (Entry.DefaultClause clause : group.defaults()) {
				String member = ((Expr.SymbolRef) clause.value()).name();
				if (table.evaluate(clause.condition()).isEnabled()
						&& table.evaluate(table.dependsOn(member)).isEnabled()) {
					selected = member;
					break;
				}
			}
			if (selected == null && !group.optional()) {
				for (String member : group.members()) {
					if (table.evaluate(table.dependsOn(member)).isEnabled()) {
						selected = member;
						break;
					}
				}
			}
		}
		boolean changed = false;
		for (String member : group.members()) {
			String value = member.equals(selected) ? Tristate.Y.token() : Tristate.N.token();
			Symbol symbol = table.symbol(member).orElseThrow();
			if (!value.equals(symbol.value())) {
				table.assign(member, value, ValueOrigin.DEFAULT);
				changed = true;
			}
		}
		return changed;
	}

	/**
	 * Whether {@code value} is acceptable for a symbol of the given kind.
	 */
	static boolean isWellFormed(SymbolKind kind, String value) {
		if (value == null) {
			return false;
		}
		return switch (kind) {
			case BOOL -> value.equals("y") || value.equals("n");
			case TRISTATE -> Tristate.fromToken(value).map(t -> t.token().equals(value)).orElse(false);
			case STRING -> true;
			case INT -> ExpressionEvaluator.parseDecimal(value) != null;
			case HEX -> ExpressionEvaluator.parseHex(value) != null;
		};
	}
}
