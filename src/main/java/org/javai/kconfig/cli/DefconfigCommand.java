package org.javai.kconfig.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import java.io.IOException;
import java.nio.file.Path;
import org.javai.kconfig.Kconfig;
import org.javai.kconfig.config.ConfigWriter;

@Parameters(separators = "= ", commandDescription = "Write a full .config from a defconfig file")
class DefconfigCommand implements CliCommand {

	@Parameter(names = "--input", description = "Minimal configuration to start from")
	private String input;

	@Parameter(names = "--output", description = "Configuration file to write")
	private String output;

	@Override
	public String name() {
		return "defconfig";
	}

	@Override
	public int execute(CommandContext context) throws IOException {
		Path inputFile = CommandContext.pathOr(input, context.settings().defconfig());
		Path outputFile = CommandContext.pathOr(output, context.settings().config());
		Kconfig kconfig = context.load();
		if (!context.applySaved(kconfig, inputFile)) {
			context.err().println("error: defconfig file not found: " + inputFile);
			return KconfigCommand.EXIT_FAILURE;
		}
		new ConfigWriter().write(outputFile, kconfig.symbols());
		context.out().println("Wrote " + outputFile);
		return KconfigCommand.EXIT_OK;
	}
}
