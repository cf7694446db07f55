package org.javai.kconfig.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.javai.kconfig.Kconfig;
import org.javai.kconfig.config.SymbolTableJsonExporter;

@Parameters(commandDescription = "Load the Kconfig tree and report its symbols")
class ParseCommand implements CliCommand {

	@Parameter(names = "--json", description = "Print the symbol table as JSON")
	private boolean json;

	@Override
	public String name() {
		return "parse";
	}

	@Override
	public int execute(CommandContext context) {
		Kconfig kconfig = context.load();
		if (json) {
			context.out().println(SymbolTableJsonExporter.toPrettyString(kconfig.symbols()));
		}
		else {
			context.out().println("Parsed " + kconfig.symbols().size() + " symbols in "
					+ kconfig.symbols().choices().size() + " choice groups from " + context.settings().kconfig());
		}
		return KconfigCommand.EXIT_OK;
	}
}
