package org.javai.kconfig.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FileLoader} backed by the default file system, reading UTF-8 text.
 */
public final class FileSystemLoader implements FileLoader {

	@Override
	public String readFile(Path path) throws IOException {
		return Files.readString(path, StandardCharsets.UTF_8);
	}
}
