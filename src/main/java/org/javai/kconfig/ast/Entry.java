package org.javai.kconfig.ast;

import java.util.List;
import java.util.Objects;

/**
 * A directive in a Kconfig file. Sealed to ensure all directive kinds are known.
 * <p>
 * Entries can be:
 * <ul>
 *   <li>{@link Config} - a {@code config} or {@code menuconfig} symbol definition</li>
 *   <li>{@link Menu} - a {@code menu}/{@code endmenu} block</li>
 *   <li>{@link Choice} - a {@code choice}/{@code endchoice} group</li>
 *   <li>{@link If} - an {@code if}/{@code endif} block</li>
 *   <li>{@link Source} - a {@code source} directive, replaced by the included entries once resolved</li>
 *   <li>{@link Comment} - a {@code comment} line shown in menus</li>
 * </ul>
 */
public sealed interface Entry {

	Location location();

	/**
	 * A symbol definition with its property list.
	 *
	 * @param name the symbol id
	 * @param menuconfig whether it was declared with {@code menuconfig}
	 * @param kind the declared type, {@code null} if no type property was given
	 * @param prompt the user-facing prompt, {@code null} for invisible symbols
	 * @param defaults default clauses in declaration order
	 * @param dependsOn each {@code depends on} clause, in order
	 * @param selects {@code select} clauses
	 * @param implies {@code imply} clauses
	 * @param ranges {@code range} clauses (kept for display only)
	 * @param help help text, {@code null} if none
	 */
	record Config(
			String name,
			boolean menuconfig,
			SymbolKind kind,
			Prompt prompt,
			List<DefaultClause> defaults,
			List<Expr> dependsOn,
			List<ReverseDependency> selects,
			List<ReverseDependency> implies,
			List<RangeClause> ranges,
			String help,
			Location location
	) implements Entry {
		public Config {
			Objects.requireNonNull(name, "name must not be null");
			defaults = defaults != null ? List.copyOf(defaults) : List.of();
			dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
			selects = selects != null ? List.copyOf(selects) : List.of();
			implies = implies != null ? List.copyOf(implies) : List.of();
			ranges = ranges != null ? List.copyOf(ranges) : List.of();
		}
	}

	record Menu(String title, List<Expr> dependsOn, Expr visibleIf, List<Entry> entries, Location location)
			implements Entry {
		public Menu {
			dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
			entries = entries != null ? List.copyOf(entries) : List.of();
		}
	}

	/**
	 * A choice group. Members are the {@link Config} entries found directly in
	 * {@code entries} or inside nested {@link If} blocks.
	 *
	 * @param name optional choice name, {@code null} when anonymous
	 * @param defaults {@code default MEMBER [if expr]} clauses
	 * @param optional whether the group may have no member selected
	 */
	record Choice(
			String name,
			SymbolKind kind,
			Prompt prompt,
			List<DefaultClause> defaults,
			List<Expr> dependsOn,
			boolean optional,
			String help,
			List<Entry> entries,
			Location location
	) implements Entry {
		public Choice {
			defaults = defaults != null ? List.copyOf(defaults) : List.of();
			dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
			entries = entries != null ? List.copyOf(entries) : List.of();
		}
	}

	record If(Expr condition, List<Entry> entries, Location location) implements Entry {
		public If {
			Objects.requireNonNull(condition, "condition must not be null");
			entries = entries != null ? List.copyOf(entries) : List.of();
		}
	}

	record Source(String path, Location location) implements Entry {
		public Source {
			Objects.requireNonNull(path, "path must not be null");
		}
	}

	record Comment(String text, List<Expr> dependsOn, Location location) implements Entry {
		public Comment {
			dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
		}
	}

	/**
	 * Prompt text with its optional {@code if} condition.
	 */
	record Prompt(String text, Expr condition) {
	}

	/**
	 * {@code default value [if condition]}.
	 */
	record DefaultClause(Expr value, Expr condition) {
		public DefaultClause {
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	/**
	 * A {@code select} or {@code imply} edge as written on the source symbol.
	 */
	record ReverseDependency(String target, Expr condition) {
		public ReverseDependency {
			Objects.requireNonNull(target, "target must not be null");
		}
	}

	record RangeClause(Expr low, Expr high, Expr condition) {
	}

	/**
	 * Position of a directive in its source file.
	 */
	record Location(String file, int line) {
		@Override
		public String toString() {
			return file + ":" + line;
		}
	}
}
