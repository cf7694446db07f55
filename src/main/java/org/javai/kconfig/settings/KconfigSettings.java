package org.javai.kconfig.settings;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Paths and options used by the command line front end.
 *
 * @param kconfig the top-level Kconfig file
 * @param srctree the directory {@code source} paths are resolved against
 * @param config the {@code .config} file
 * @param autoConf the generated {@code auto.conf}
 * @param autoconfHeader the generated {@code autoconf.h}
 * @param defconfig the minimal configuration file
 * @param strictSelectCycles whether a select/imply cycle is a load error
 */
public record KconfigSettings(
		Path kconfig,
		Path srctree,
		Path config,
		Path autoConf,
		Path autoconfHeader,
		Path defconfig,
		boolean strictSelectCycles
) {

	public KconfigSettings {
		Objects.requireNonNull(kconfig, "kconfig must not be null");
		Objects.requireNonNull(srctree, "srctree must not be null");
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(autoConf, "autoConf must not be null");
		Objects.requireNonNull(autoconfHeader, "autoconfHeader must not be null");
		Objects.requireNonNull(defconfig, "defconfig must not be null");
	}

	public static KconfigSettings defaults() {
		return new KconfigSettings(
				Path.of("Kconfig"),
				Path.of("."),
				Path.of(".config"),
				Path.of("include/config/auto.conf"),
				Path.of("include/generated/autoconf.h"),
				Path.of("defconfig"),
				false);
	}

	public KconfigSettings withKconfig(Path path) {
		return new KconfigSettings(path, srctree, config, autoConf, autoconfHeader, defconfig, strictSelectCycles);
	}

	public KconfigSettings withSrctree(Path path) {
		return new KconfigSettings(kconfig, path, config, autoConf, autoconfHeader, defconfig, strictSelectCycles);
	}
}
