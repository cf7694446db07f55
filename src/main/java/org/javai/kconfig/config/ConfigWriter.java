package org.javai.kconfig.config;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.kconfig.eval.Tristate;
import org.javai.kconfig.symbol.Symbol;
import org.javai.kconfig.symbol.SymbolTable;

/**
 * Writes symbol values as a {@code .config} file, ids without the {@code CONFIG_} prefix.
 * <p>
 * bool and tristate values are written as {@code ID=y} / {@code ID=m}, or
 * {@code # ID is not set} for {@code n}; strings are quoted and escaped; int and hex are
 * written raw.
 */
public class ConfigWriter {

	static final String HEADER = "#\n# Automatically generated file; DO NOT EDIT.\n";

	public void write(Path path, SymbolTable table) throws IOException {
		createParent(path);
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			write(writer, table);
		}
	}

	public void write(Writer writer, SymbolTable table) throws IOException {
		writeHeader(writer, table);
		for (Symbol symbol : table.symbols()) {
			writer.write(line(symbol));
			writer.write('\n');
		}
	}

	/**
	 * Writes only the symbols whose value differs from {@code defaults}, a freshly built
	 * table for the same tree.
	 */
	public void writeMinimal(Path path, SymbolTable table, SymbolTable defaults) throws IOException {
		createParent(path);
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writeMinimal(writer, table, defaults);
		}
	}

	public void writeMinimal(Writer writer, SymbolTable table, SymbolTable defaults) throws IOException {
		for (Symbol symbol : table.symbols()) {
			String defaultValue = defaults.valueOf(symbol.id()).orElse(null);
			if (!symbol.value().equals(defaultValue)) {
				writer.write(line(symbol));
				writer.write('\n');
			}
		}
	}

	static String line(Symbol symbol) {
		return switch (symbol.kind()) {
			case BOOL, TRISTATE -> symbol.tristate() == Tristate.N
					? "# " + symbol.id() + " is not set"
					: symbol.id() + "=" + symbol.tristate().token();
			case STRING -> symbol.id() + "=" + quote(symbol.value());
			case INT, HEX -> symbol.id() + "=" + symbol.value();
		};
	}

	static String quote(String value) {
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	private static void writeHeader(Writer writer, SymbolTable table) throws IOException {
		writer.write(HEADER);
		if (table.mainMenu() != null) {
			writer.write("# " + table.mainMenu() + "\n");
		}
		writer.write("#\n");
	}

	static void createParent(Path path) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
	}
}
