package org.javai.kconfig.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.symbol.ChoiceGroup;
import org.javai.kconfig.symbol.Symbol;
import org.javai.kconfig.symbol.SymbolEdge;
import org.javai.kconfig.symbol.SymbolTable;

/**
 * Converts a symbol table to JSON for tooling and diagnostics.
 */
public final class SymbolTableJsonExporter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private SymbolTableJsonExporter() {
	}

	public static ObjectNode toJson(SymbolTable table) {
		ObjectNode root = mapper.createObjectNode();
		if (table.mainMenu() != null) {
			root.put("mainMenu", table.mainMenu());
		}
		ArrayNode symbols = root.putArray("symbols");
		for (Symbol symbol : table.symbols()) {
			symbols.add(toJson(symbol, table));
		}
		ArrayNode choices = root.putArray("choices");
		for (ChoiceGroup group : table.choices()) {
			ObjectNode node = choices.addObject();
			node.put("name", group.name());
			node.put("type", group.kind().keyword());
			node.put("optional", group.optional());
			ArrayNode members = node.putArray("members");
			group.members().forEach(members::add);
		}
		return root;
	}

	public static ObjectNode toJson(Symbol symbol, SymbolTable table) {
		ObjectNode node = mapper.createObjectNode();
		node.put("id", symbol.id());
		node.put("type", symbol.kind().keyword());
		node.put("value", symbol.value());
		node.put("origin", symbol.origin().name().toLowerCase(Locale.ROOT));
		if (symbol.prompt() != null) {
			node.put("prompt", symbol.prompt());
		}
		node.put("visible", table.isVisible(symbol.id()));
		Expr dependsOn = table.dependsOn(symbol.id());
		if (dependsOn != null) {
			node.put("dependsOn", dependsOn.toString());
		}
		putEdges(node, "selects", table.selects(symbol.id()));
		putEdges(node, "implies", table.implies(symbol.id()));
		if (symbol.choice() != null) {
			node.put("choice", symbol.choice());
		}
		if (symbol.location() != null) {
			node.put("location", symbol.location().toString());
		}
		return node;
	}

	public static String toPrettyString(SymbolTable table) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(table));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render symbol table as JSON", e);
		}
	}

	private static void putEdges(ObjectNode node, String field, List<SymbolEdge> edges) {
		if (edges.isEmpty()) {
			return;
		}
		ArrayNode array = node.putArray(field);
		for (SymbolEdge edge : edges) {
			ObjectNode edgeNode = array.addObject();
			edgeNode.put("target", edge.target());
			if (edge.condition() != null) {
				edgeNode.put("if", edge.condition().toString());
			}
		}
	}
}
