package org.javai.kconfig.symbol;

import java.util.List;
import java.util.Objects;
import org.javai.kconfig.ast.Entry;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.SymbolKind;
import org.javai.kconfig.eval.ExpressionEvaluator;
import org.javai.kconfig.eval.Tristate;

/**
 * One configuration option.
 * <p>
 * Instances are owned by a {@link SymbolTable} and are live: {@link #value()} always
 * reflects the table's current state, including changes made by select cascades. Only the
 * table's builder and {@link DependencyResolver} change the value.
 */
public final class Symbol {

	private final String id;
	private final SymbolKind kind;
	private final String prompt;
	private final Expr promptCondition;
	private final List<Entry.DefaultClause> defaults;
	private final Expr dependsOn;
	private final List<SymbolEdge> selects;
	private final List<SymbolEdge> implies;
	private final String help;
	private final String choice;
	private final boolean menuconfig;
	private final Entry.Location location;

	private String value;
	private ValueOrigin origin = ValueOrigin.DEFAULT;

	Symbol(String id, SymbolKind kind, String prompt, Expr promptCondition, List<Entry.DefaultClause> defaults,
			Expr dependsOn, List<SymbolEdge> selects, List<SymbolEdge> implies, String help, String choice,
			boolean menuconfig, Entry.Location location) {
		this.id = Objects.requireNonNull(id, "id must not be null");
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.prompt = prompt;
		this.promptCondition = promptCondition;
		this.defaults = List.copyOf(defaults);
		this.dependsOn = dependsOn;
		this.selects = List.copyOf(selects);
		this.implies = List.copyOf(implies);
		this.help = help;
		this.choice = choice;
		this.menuconfig = menuconfig;
		this.location = location;
		this.value = emptyValue(kind);
	}

	public String id() {
		return id;
	}

	public SymbolKind kind() {
		return kind;
	}

	/**
	 * The prompt text, or {@code null} for symbols that are not user-visible.
	 */
	public String prompt() {
		return prompt;
	}

	public boolean hasPrompt() {
		return prompt != null;
	}

	/**
	 * Conjunction of the prompt's own {@code if} and any enclosing menu {@code visible if}.
	 */
	public Expr promptCondition() {
		return promptCondition;
	}

	public List<Entry.DefaultClause> defaults() {
		return defaults;
	}

	/**
	 * Conjunction of all enclosing guards and this symbol's {@code depends on} clauses,
	 * {@code null} when unconditional.
	 */
	public Expr dependsOn() {
		return dependsOn;
	}

	public List<SymbolEdge> selects() {
		return selects;
	}

	public List<SymbolEdge> implies() {
		return implies;
	}

	public String help() {
		return help;
	}

	/**
	 * Name of the choice group this symbol belongs to, {@code null} if none.
	 */
	public String choice() {
		return choice;
	}

	public boolean isMenuconfig() {
		return menuconfig;
	}

	public Entry.Location location() {
		return location;
	}

	/**
	 * The raw current value: {@code y}/{@code m}/{@code n} for bool and tristate, text for
	 * string, int and hex.
	 */
	public String value() {
		return value;
	}

	public ValueOrigin origin() {
		return origin;
	}

	/**
	 * The current value coerced to the tristate domain.
	 */
	public Tristate tristate() {
		return ExpressionEvaluator.coerce(kind, value);
	}

	void assign(String value, ValueOrigin origin) {
		this.value = value;
		this.origin = origin;
	}

	/**
	 * The value a symbol of this kind holds when nothing else applies.
	 */
	static String emptyValue(SymbolKind kind) {
		return switch (kind) {
			case BOOL, TRISTATE -> Tristate.N.token();
			case STRING -> "";
			case INT -> "0";
			case HEX -> "0x0";
		};
	}

	@Override
	public String toString() {
		return id + "=" + value;
	}
}
