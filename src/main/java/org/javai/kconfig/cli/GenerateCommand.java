package org.javai.kconfig.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import java.io.IOException;
import java.nio.file.Path;
import org.javai.kconfig.Kconfig;
import org.javai.kconfig.config.ConfigGenerator;

@Parameters(separators = "= ", commandDescription = "Generate auto.conf and autoconf.h from a .config")
class GenerateCommand implements CliCommand {

	@Parameter(names = "--config", description = "Configuration file to read")
	private String config;

	@Parameter(names = "--auto-conf", description = "Make fragment to write")
	private String autoConf;

	@Parameter(names = "--header", description = "C header to write")
	private String header;

	@Override
	public String name() {
		return "generate";
	}

	@Override
	public int execute(CommandContext context) throws IOException {
		Path configFile = CommandContext.pathOr(config, context.settings().config());
		Path autoConfFile = CommandContext.pathOr(autoConf, context.settings().autoConf());
		Path headerFile = CommandContext.pathOr(header, context.settings().autoconfHeader());
		Kconfig kconfig = context.load();
		context.applySaved(kconfig, configFile);
		ConfigGenerator generator = new ConfigGenerator();
		generator.writeAutoConf(autoConfFile, kconfig.symbols());
		generator.writeAutoconfHeader(headerFile, kconfig.symbols());
		context.out().println("Wrote " + autoConfFile + " and " + headerFile);
		return KconfigCommand.EXIT_OK;
	}
}
