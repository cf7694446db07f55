package org.javai.kconfig.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.kconfig.settings.KconfigSettings;
import org.javai.kconfig.settings.KconfigSettingsParser;

/**
 * Options accepted before the command name.
 */
@Parameters(separators = "= ")
class GlobalOptions {

	static final String DEFAULT_SETTINGS_FILE = "kconfig.yml";

	@Parameter(names = "--settings", description = "YAML settings file (default: kconfig.yml if present)")
	private String settings;

	@Parameter(names = "--kconfig", description = "Top-level Kconfig file")
	private String kconfig;

	@Parameter(names = "--srctree", description = "Directory relative source paths are resolved against")
	private String srctree;

	@Parameter(names = {"-h", "--help"}, help = true, description = "Show usage")
	private boolean help;

	boolean help() {
		return help;
	}

	/**
	 * Settings from the settings file, or defaults when there is none, with command line
	 * flags taking precedence.
	 */
	KconfigSettings resolveSettings() {
		KconfigSettings resolved;
		if (settings != null) {
			resolved = new KconfigSettingsParser().parse(Path.of(settings));
		}
		else if (Files.isRegularFile(Path.of(DEFAULT_SETTINGS_FILE))) {
			resolved = new KconfigSettingsParser().parse(Path.of(DEFAULT_SETTINGS_FILE));
		}
		else {
			resolved = KconfigSettings.defaults();
		}
		if (kconfig != null) {
			resolved = resolved.withKconfig(Path.of(kconfig));
		}
		if (srctree != null) {
			resolved = resolved.withSrctree(Path.of(srctree));
		}
		return resolved;
	}
}
