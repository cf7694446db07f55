package org.javai.kconfig.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.kconfig.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigReaderTest {

	private final ConfigReader reader = new ConfigReader();

	@Test
	void readsAssignmentsAndNotSetLines() {
		Map<String, String> values = reader.parse("""
				#
				# Automatically generated file; DO NOT EDIT.
				#
				NET=y
				DRIVER=m
				# DEBUG is not set
				COUNT=16
				BASE=0x1000
				""");

		assertThat(values).containsExactly(
				entry("NET", "y"),
				entry("DRIVER", "m"),
				entry("DEBUG", "n"),
				entry("COUNT", "16"),
				entry("BASE", "0x1000"));
	}

	@Test
	void acceptsLegacyPrefix() {
		Map<String, String> values = reader.parse("CONFIG_NET=y\n# CONFIG_DEBUG is not set\n");

		assertThat(values).containsOnly(entry("NET", "y"), entry("DEBUG", "n"));
	}

	@Test
	void unquotesStrings() {
		Map<String, String> values = reader.parse("NAME=\"say \\\"hi\\\" to C:\\\\\"\nEMPTY=\"\"\n");

		assertThat(values).containsEntry("NAME", "say \"hi\" to C:\\").containsEntry("EMPTY", "");
	}

	@Test
	void laterLinesWin() {
		assertThat(reader.parse("NET=y\nNET=n\n")).containsOnly(entry("NET", "n"));
	}

	@Test
	void skipsMalformedLinesWithWarning() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(ConfigReader.class, Level.WARN)) {
			Map<String, String> values = reader.parse("NET=y\nthis is not a setting\n\nDEBUG=n\n");

			assertThat(values).containsOnly(entry("NET", "y"), entry("DEBUG", "n"));
			assertThat(captor.messages(Level.WARN))
					.containsExactly("Skipping malformed config line 2: this is not a setting");
		}
	}

	@Test
	void readsFromFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve(".config");
		Files.writeString(file, "NET=y\n");

		assertThat(reader.read(file)).containsOnly(entry("NET", "y"));
	}
}
