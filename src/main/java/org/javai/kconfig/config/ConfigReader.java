package org.javai.kconfig.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code .config} style files into id/value pairs.
 * <p>
 * Accepts {@code ID=value} and {@code # ID is not set} lines, with or without a
 * {@code CONFIG_} prefix; ids are returned without the prefix. Quoted values are
 * unquoted and unescaped. Other comments and blank lines are skipped; malformed lines are
 * skipped with a warning.
 */
public class ConfigReader {

	private static final Logger logger = LoggerFactory.getLogger(ConfigReader.class);

	static final String PREFIX = "CONFIG_";

	private static final Pattern NOT_SET = Pattern.compile("#\\s*([A-Za-z0-9_]+) is not set");
	private static final Pattern ASSIGNMENT = Pattern.compile("([A-Za-z0-9_]+)\\s*=(.*)");

	public Map<String, String> read(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	public Map<String, String> read(Reader reader) throws IOException {
		Map<String, String> values = new LinkedHashMap<>();
		BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
		String line;
		int lineNumber = 0;
		while ((line = lines.readLine()) != null) {
			lineNumber++;
			String trimmed = line.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			if (trimmed.startsWith("#")) {
				Matcher notSet = NOT_SET.matcher(trimmed);
				if (notSet.matches()) {
					values.put(stripPrefix(notSet.group(1)), "n");
				}
				continue;
			}
			Matcher assignment = ASSIGNMENT.matcher(trimmed);
			if (!assignment.matches()) {
				logger.warn("Skipping malformed config line {}: {}", lineNumber, trimmed);
				continue;
			}
			values.put(stripPrefix(assignment.group(1)), unquote(assignment.group(2).trim()));
		}
		return values;
	}

	public Map<String, String> parse(String content) {
		try {
			return read(new StringReader(content != null ? content : ""));
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	static String stripPrefix(String id) {
		return id.startsWith(PREFIX) && id.length() > PREFIX.length() ? id.substring(PREFIX.length()) : id;
	}

	private static String unquote(String value) {
		if (value.length() < 2 || value.charAt(0) != '"' || value.charAt(value.length() - 1) != '"') {
			return value;
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 1; i < value.length() - 1; i++) {
			char c = value.charAt(i);
			if (c == '\\' && i + 1 < value.length() - 1) {
				sb.append(value.charAt(++i));
			}
			else {
				sb.append(c);
			}
		}
		return sb.toString();
	}
}
