package org.javai.kconfig.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.kconfig.KconfigLoadException;
import org.javai.kconfig.settings.KconfigSettings;
import org.javai.kconfig.settings.SettingsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code kconfig} command line tool.
 * <p>
 * Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_FAILURE} when loading or file
 * I/O fails, {@value #EXIT_USAGE} on a usage error.
 */
public class KconfigCommand {

	private static final Logger logger = LoggerFactory.getLogger(KconfigCommand.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	private final PrintStream out;
	private final PrintStream err;

	public KconfigCommand(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		System.exit(new KconfigCommand(System.out, System.err).run(args));
	}

	public int run(String... args) {
		GlobalOptions options = new GlobalOptions();
		Map<String, CliCommand> commands = new LinkedHashMap<>();
		for (CliCommand command : List.of(new ParseCommand(), new DefconfigCommand(), new OldconfigCommand(),
				new SaveconfigCommand(), new GenerateCommand(), new MenuconfigCommand())) {
			commands.put(command.name(), command);
		}

		JCommander.Builder builder = JCommander.newBuilder().programName("kconfig").addObject(options);
		for (Map.Entry<String, CliCommand> command : commands.entrySet()) {
			builder.addCommand(command.getKey(), command.getValue());
		}
		JCommander jCommander = builder.build();

		try {
			jCommander.parse(args);
		}
		catch (ParameterException e) {
			err.println("error: " + e.getMessage());
			printUsage(jCommander);
			return EXIT_USAGE;
		}
		if (options.help()) {
			printUsage(jCommander);
			return EXIT_OK;
		}
		String parsed = jCommander.getParsedCommand();
		if (parsed == null) {
			err.println("error: no command given");
			printUsage(jCommander);
			return EXIT_USAGE;
		}

		try {
			KconfigSettings settings = options.resolveSettings();
			logger.debug("Running {} with {}", parsed, settings);
			return commands.get(parsed).execute(new CommandContext(settings, out, err));
		}
		catch (SettingsException | KconfigLoadException e) {
			err.println("error: " + e.getMessage());
			return EXIT_FAILURE;
		}
		catch (IOException | UncheckedIOException e) {
			logger.debug("I/O failure running {}", parsed, e);
			err.println("error: " + e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private void printUsage(JCommander jCommander) {
		StringBuilder usage = new StringBuilder();
		jCommander.getUsageFormatter().usage(usage);
		err.print(usage);
	}
}
