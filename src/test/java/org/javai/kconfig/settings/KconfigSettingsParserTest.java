package org.javai.kconfig.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KconfigSettingsParserTest {

	private final KconfigSettingsParser parser = new KconfigSettingsParser();

	@Test
	void emptyDocumentYieldsDefaults() {
		KconfigSettings settings = parser.parseString("");

		assertThat(settings).isEqualTo(KconfigSettings.defaults());
		assertThat(settings.kconfig()).isEqualTo(Path.of("Kconfig"));
		assertThat(settings.srctree()).isEqualTo(Path.of("."));
		assertThat(settings.config()).isEqualTo(Path.of(".config"));
		assertThat(settings.autoConf()).isEqualTo(Path.of("include/config/auto.conf"));
		assertThat(settings.autoconfHeader()).isEqualTo(Path.of("include/generated/autoconf.h"));
		assertThat(settings.defconfig()).isEqualTo(Path.of("defconfig"));
		assertThat(settings.strictSelectCycles()).isFalse();
	}

	@Test
	void parsesAllKeys() {
		KconfigSettings settings = parser.parseString("""
				kconfig: src/Kconfig
				srctree: src
				config: build/.config
				auto_conf: build/auto.conf
				autoconf_header: build/autoconf.h
				defconfig: configs/minimal
				strict_select_cycles: true
				""");

		assertThat(settings.kconfig()).isEqualTo(Path.of("src/Kconfig"));
		assertThat(settings.srctree()).isEqualTo(Path.of("src"));
		assertThat(settings.config()).isEqualTo(Path.of("build/.config"));
		assertThat(settings.autoConf()).isEqualTo(Path.of("build/auto.conf"));
		assertThat(settings.autoconfHeader()).isEqualTo(Path.of("build/autoconf.h"));
		assertThat(settings.defconfig()).isEqualTo(Path.of("configs/minimal"));
		assertThat(settings.strictSelectCycles()).isTrue();
	}

	@Test
	void missingKeysKeepDefaults() {
		KconfigSettings settings = parser.parse(new ByteArrayInputStream(
				"config: out/.config\n".getBytes(StandardCharsets.UTF_8)));

		assertThat(settings.config()).isEqualTo(Path.of("out/.config"));
		assertThat(settings.kconfig()).isEqualTo(Path.of("Kconfig"));
	}

	@Test
	void relativePathsResolveAgainstSettingsFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("kconfig.yml");
		Files.writeString(file, "kconfig: tree/Kconfig\nsrctree: tree\n");

		KconfigSettings settings = parser.parse(file);

		assertThat(settings.kconfig()).isEqualTo(dir.toAbsolutePath().resolve("tree/Kconfig"));
		assertThat(settings.srctree()).isEqualTo(dir.toAbsolutePath().resolve("tree"));
		assertThat(settings.config()).isEqualTo(dir.toAbsolutePath().resolve(".config"));
	}

	@Test
	void unknownKeyIsRejected() {
		assertThatThrownBy(() -> parser.parseString("kconfig: Kconfig\noutput: x\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessage("Unknown settings key: output");
	}

	@Test
	void wrongValueTypesAreRejected() {
		assertThatThrownBy(() -> parser.parseString("strict_select_cycles: sometimes\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("must be true or false");
		assertThatThrownBy(() -> parser.parseString("config: [a, b]\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("must be a non-empty path");
	}

	@Test
	void nonMappingDocumentIsRejected() {
		assertThatThrownBy(() -> parser.parseString("- one\n- two\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("must be a mapping");
	}

	@Test
	void malformedYamlIsWrapped() {
		assertThatThrownBy(() -> parser.parseString("kconfig: [unclosed\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessage("Failed to parse settings from string")
				.hasCauseInstanceOf(Exception.class);
	}

	@Test
	void missingFileIsWrapped(@TempDir Path dir) {
		Path missing = dir.resolve("absent.yml");

		assertThatThrownBy(() -> parser.parse(missing))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("absent.yml");
	}

	@Test
	void commandLineOverridesReplaceTreeLocation() {
		KconfigSettings settings = KconfigSettings.defaults()
				.withKconfig(Path.of("other/Kconfig"))
				.withSrctree(Path.of("other"));

		assertThat(settings.kconfig()).isEqualTo(Path.of("other/Kconfig"));
		assertThat(settings.srctree()).isEqualTo(Path.of("other"));
		assertThat(settings.config()).isEqualTo(Path.of(".config"));
	}
}
