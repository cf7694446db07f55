package org.javai.kconfig.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import java.io.IOException;
import java.nio.file.Path;
import org.javai.kconfig.Kconfig;
import org.javai.kconfig.config.ConfigWriter;

@Parameters(separators = "= ", commandDescription = "Write a minimal defconfig from a .config")
class SaveconfigCommand implements CliCommand {

	@Parameter(names = "--config", description = "Configuration file to read")
	private String config;

	@Parameter(names = "--output", description = "Minimal configuration file to write")
	private String output;

	@Override
	public String name() {
		return "saveconfig";
	}

	@Override
	public int execute(CommandContext context) throws IOException {
		Path configFile = CommandContext.pathOr(config, context.settings().config());
		Path outputFile = CommandContext.pathOr(output, context.settings().defconfig());
		Kconfig kconfig = context.load();
		context.applySaved(kconfig, configFile);
		Kconfig defaults = context.load();
		new ConfigWriter().writeMinimal(outputFile, kconfig.symbols(), defaults.symbols());
		context.out().println("Wrote " + outputFile);
		return KconfigCommand.EXIT_OK;
	}
}
