package org.javai.kconfig.settings;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for {@code kconfig.yml} settings files.
 * <p>
 * Recognized keys: {@code kconfig}, {@code srctree}, {@code config}, {@code auto_conf},
 * {@code autoconf_header}, {@code defconfig}, {@code strict_select_cycles}. Missing keys
 * keep their {@link KconfigSettings#defaults() default}. When parsing from a path,
 * relative paths are resolved against the settings file's directory.
 */
public class KconfigSettingsParser {

	private static final Set<String> KEYS = Set.of("kconfig", "srctree", "config", "auto_conf", "autoconf_header",
			"defconfig", "strict_select_cycles");

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a settings file from a path.
	 */
	public KconfigSettings parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			Path base = path.toAbsolutePath().getParent();
			return build(yaml.load(reader), base);
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings from path: " + path, e);
		}
	}

	/**
	 * Parse settings from an input stream; relative paths are kept as given.
	 */
	public KconfigSettings parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream), null);
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings from input stream", e);
		}
	}

	/**
	 * Parse settings from a string; relative paths are kept as given.
	 */
	public KconfigSettings parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent), null);
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings from string", e);
		}
	}

	private KconfigSettings build(Object document, Path base) {
		KconfigSettings defaults = KconfigSettings.defaults();
		if (document == null) {
			return resolveAll(defaults, base);
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new SettingsException("Settings must be a mapping, found: " + document.getClass().getSimpleName());
		}
		for (Object key : data.keySet()) {
			if (!KEYS.contains(String.valueOf(key))) {
				throw new SettingsException("Unknown settings key: " + key);
			}
		}
		KconfigSettings settings = new KconfigSettings(
				path(data, "kconfig", defaults.kconfig()),
				path(data, "srctree", defaults.srctree()),
				path(data, "config", defaults.config()),
				path(data, "auto_conf", defaults.autoConf()),
				path(data, "autoconf_header", defaults.autoconfHeader()),
				path(data, "defconfig", defaults.defconfig()),
				flag(data, "strict_select_cycles", defaults.strictSelectCycles()));
		return resolveAll(settings, base);
	}

	private static Path path(Map<?, ?> data, String key, Path fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof String text) || text.isBlank()) {
			throw new SettingsException("Setting '" + key + "' must be a non-empty path");
		}
		return Path.of(text);
	}

	private static boolean flag(Map<?, ?> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Boolean bool)) {
			throw new SettingsException("Setting '" + key + "' must be true or false");
		}
		return bool;
	}

	private static KconfigSettings resolveAll(KconfigSettings settings, Path base) {
		if (base == null) {
			return settings;
		}
		return new KconfigSettings(
				base.resolve(settings.kconfig()),
				base.resolve(settings.srctree()).normalize(),
				base.resolve(settings.config()),
				base.resolve(settings.autoConf()),
				base.resolve(settings.autoconfHeader()),
				base.resolve(settings.defconfig()),
				settings.strictSelectCycles());
	}
}
