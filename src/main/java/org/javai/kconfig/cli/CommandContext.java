package org.javai.kconfig.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.javai.kconfig.Kconfig;
import org.javai.kconfig.config.ConfigApplier;
import org.javai.kconfig.config.ConfigReader;
import org.javai.kconfig.settings.KconfigSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What a command needs from its invocation: the effective settings and the output
 * streams.
 */
final class CommandContext {

	private static final Logger logger = LoggerFactory.getLogger(CommandContext.class);

	private final KconfigSettings settings;
	private final PrintStream out;
	private final PrintStream err;

	CommandContext(KconfigSettings settings, PrintStream out, PrintStream err) {
		this.settings = settings;
		this.out = out;
		this.err = err;
	}

	KconfigSettings settings() {
		return settings;
	}

	PrintStream out() {
		return out;
	}

	PrintStream err() {
		return err;
	}

	Kconfig load() {
		return Kconfig.load(settings);
	}

	/**
	 * Applies the saved values in {@code configFile}, if it exists, and reports what did
	 * not apply on the error stream.
	 *
	 * @return whether a file was found
	 */
	boolean applySaved(Kconfig kconfig, Path configFile) throws IOException {
		if (!Files.isRegularFile(configFile)) {
			logger.debug("No saved configuration at {}", configFile);
			return false;
		}
		Map<String, String> values = new ConfigReader().read(configFile);
		ConfigApplier.ApplyReport report = new ConfigApplier(kconfig.resolver()).apply(values);
		report.rejected().forEach((id, error) -> err.println("warning: " + configFile + ": " + error.message()));
		report.unknown().forEach(id -> err.println("warning: " + configFile + ": unknown symbol " + id));
		return true;
	}

	static Path pathOr(String option, Path fallback) {
		return option != null ? Path.of(option) : fallback;
	}
}
