package org.javai.kconfig.source;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.javai.kconfig.KconfigLoadException;

/**
 * Thrown when a {@code source} directive includes a file that is already being loaded.
 */
public class SourceCycleException extends KconfigLoadException {

	private final List<Path> chain;

	/**
	 * @param chain the inclusion chain, starting and ending with the repeated file
	 */
	public SourceCycleException(List<Path> chain) {
		super("Source cycle detected: " + chain.stream().map(Path::toString).collect(Collectors.joining(" -> ")));
		this.chain = List.copyOf(chain);
	}

	public List<Path> chain() {
		return chain;
	}
}
