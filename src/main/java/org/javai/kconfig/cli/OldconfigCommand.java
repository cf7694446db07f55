package org.javai.kconfig.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import java.io.IOException;
import java.nio.file.Path;
import org.javai.kconfig.Kconfig;
import org.javai.kconfig.config.ConfigWriter;

/**
 * Brings an existing configuration up to date with the tree: saved values are applied,
 * symbols the file does not mention take their defaults, and the result is written back.
 */
@Parameters(separators = "= ", commandDescription = "Update a .config to the current Kconfig tree")
class OldconfigCommand implements CliCommand {

	@Parameter(names = "--config", description = "Configuration file to update")
	private String config;

	@Override
	public String name() {
		return "oldconfig";
	}

	@Override
	public int execute(CommandContext context) throws IOException {
		Path configFile = CommandContext.pathOr(config, context.settings().config());
		Kconfig kconfig = context.load();
		context.applySaved(kconfig, configFile);
		new ConfigWriter().write(configFile, kconfig.symbols());
		context.out().println("Wrote " + configFile);
		return KconfigCommand.EXIT_OK;
	}
}
