package org.javai.kconfig.cli;

import com.beust.jcommander.Parameters;

@Parameters(commandDescription = "Interactive configuration (not available)")
class MenuconfigCommand implements CliCommand {

	@Override
	public String name() {
		return "menuconfig";
	}

	@Override
	public int execute(CommandContext context) {
		context.err().println("menuconfig: the interactive configuration UI is not part of this tool; "
				+ "edit the .config file and run 'kconfig oldconfig'");
		return KconfigCommand.EXIT_OK;
	}
}
