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
 * Generates the build-facing outputs: {@code auto.conf} for make and {@code autoconf.h}
 * for C sources. Disabled bool/tristate symbols and empty strings are omitted.
 */
public class ConfigGenerator {

	public void writeAutoConf(Path path, SymbolTable table) throws IOException {
		ConfigWriter.createParent(path);
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writeAutoConf(writer, table);
		}
	}

	public void writeAutoConf(Writer writer, SymbolTable table) throws IOException {
		writer.write(ConfigWriter.HEADER);
		writer.write("#\n");
		for (Symbol symbol : table.symbols()) {
			if (isOmitted(symbol)) {
				continue;
			}
			writer.write(ConfigWriter.line(symbol));
			writer.write('\n');
		}
	}

	public void writeAutoconfHeader(Path path, SymbolTable table) throws IOException {
		ConfigWriter.createParent(path);
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writeAutoconfHeader(writer, table);
		}
	}

	/**
	 * {@code y} and {@code m} both define the macro as {@code 1}.
	 */
	public void writeAutoconfHeader(Writer writer, SymbolTable table) throws IOException {
		writer.write("/*\n * Automatically generated file; DO NOT EDIT.\n */\n\n");
		for (Symbol symbol : table.symbols()) {
			if (isOmitted(symbol)) {
				continue;
			}
			String value = switch (symbol.kind()) {
				case BOOL, TRISTATE -> "1";
				case STRING -> ConfigWriter.quote(symbol.value());
				case INT, HEX -> symbol.value();
			};
			writer.write("#define " + symbol.id() + " " + value + "\n");
		}
	}

	private static boolean isOmitted(Symbol symbol) {
		return switch (symbol.kind()) {
			case BOOL, TRISTATE -> symbol.tristate() == Tristate.N;
			case STRING -> symbol.value().isEmpty();
			case INT, HEX -> false;
		};
	}
}
