package org.javai.kconfig.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads Kconfig source files for the {@link SourceResolver}.
 */
@FunctionalInterface
public interface FileLoader {

	/**
	 * Reads the whole file as text.
	 *
	 * @throws IOException if the file cannot be read
	 */
	String readFile(Path path) throws IOException;
}
