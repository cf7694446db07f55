package org.javai.kconfig.symbol;

import java.util.List;
import org.javai.kconfig.ast.Entry;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.SymbolKind;

/**
 * A choice group: at most one member holds {@code y} at a time.
 *
 * @param name the choice name, or a generated {@code <choice@file:line>} name when anonymous
 * @param prompt display text, {@code null} if none
 * @param kind bool or tristate
 * @param members member symbol ids in declaration order
 * @param optional whether the group may have no member selected
 * @param defaults {@code default MEMBER [if expr]} clauses
 * @param dependsOn conjunction of enclosing guards and the choice's own dependencies
 */
public record ChoiceGroup(
		String name,
		String prompt,
		SymbolKind kind,
		List<String> members,
		boolean optional,
		List<Entry.DefaultClause> defaults,
		Expr dependsOn,
		Entry.Location location
) {

	public ChoiceGroup {
		members = members != null ? List.copyOf(members) : List.of();
		defaults = defaults != null ? List.copyOf(defaults) : List.of();
	}

	public boolean contains(String id) {
		return members.contains(id);
	}
}
