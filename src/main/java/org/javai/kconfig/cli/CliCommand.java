package org.javai.kconfig.cli;

import java.io.IOException;

/**
 * One {@code kconfig} sub-command. Implementations only wire the library together.
 */
interface CliCommand {

	String name();

	/**
	 * @return the process exit code
	 */
	int execute(CommandContext context) throws IOException;
}
