package org.javai.kconfig.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.kconfig.KconfigLoadException;
import org.javai.kconfig.ast.Entry;
import org.javai.kconfig.ast.KconfigFile;
import org.javai.kconfig.parse.KconfigParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a Kconfig tree and splices every {@code source} directive in place.
 * <p>
 * A sourced path is resolved against the source tree root unless it is absolute. Included
 * entries keep their position inside enclosing {@code menu}, {@code choice} and {@code if}
 * blocks, so they inherit the enclosing conditions. The resolver keeps the stack of files
 * currently being loaded; sourcing a file already on that stack is a
 * {@link SourceCycleException} naming the full inclusion chain.
 */
public class SourceResolver {

	private static final Logger logger = LoggerFactory.getLogger(SourceResolver.class);

	private final FileLoader loader;

	public SourceResolver() {
		this(new FileSystemLoader());
	}

	public SourceResolver(FileLoader loader) {
		this.loader = Objects.requireNonNull(loader, "loader must not be null");
	}

	/**
	 * Parses {@code rootFile} and every file it sources, transitively.
	 *
	 * @param rootFile the top-level Kconfig file
	 * @param sourceTreeDir the directory relative {@code source} paths are resolved against
	 * @return the combined tree, free of {@link Entry.Source} entries
	 * @throws KconfigLoadException on I/O failure, syntax error or source cycle
	 */
	public KconfigFile resolve(Path rootFile, Path sourceTreeDir) {
		Objects.requireNonNull(rootFile, "rootFile must not be null");
		Objects.requireNonNull(sourceTreeDir, "sourceTreeDir must not be null");
		Resolution resolution = new Resolution(sourceTreeDir.toAbsolutePath().normalize());
		List<Entry> entries = resolution.load(rootFile.toAbsolutePath().normalize(), null);
		return new KconfigFile(resolution.mainMenu, entries);
	}

	/**
	 * State of a single {@link #resolve} call.
	 */
	private final class Resolution {

		private final Path sourceTree;
		private final Deque<Path> open = new ArrayDeque<>();
		private String mainMenu;

		Resolution(Path sourceTree) {
			this.sourceTree = sourceTree;
		}

		List<Entry> load(Path file, Entry.Location includedFrom) {
			if (open.contains(file)) {
				List<Path> chain = new ArrayList<>();
				for (Path path : open) {
					chain.add(display(path));
				}
				chain.add(display(file));
				throw new SourceCycleException(chain);
			}

			String name = display(file).toString();
			String text;
			try {
				text = loader.readFile(file);
			}
			catch (IOException e) {
				String message = includedFrom != null
						? "Failed to read " + name + " sourced at " + includedFrom
						: "Failed to read Kconfig file " + name;
				throw new KconfigLoadException(message, e);
			}
			logger.debug("Sourcing {}", name);

			open.addLast(file);
			try {
				KconfigFile parsed = KconfigParser.parse(text, name);
				if (mainMenu == null) {
					mainMenu = parsed.mainMenu();
				}
				return expand(parsed.entries());
			}
			finally {
				open.removeLast();
			}
		}

		private List<Entry> expand(List<Entry> entries) {
			List<Entry> expanded = new ArrayList<>(entries.size());
			for (Entry entry : entries) {
				if (entry instanceof Entry.Source source) {
					expanded.addAll(load(target(source.path()), source.location()));
				}
				else if (entry instanceof Entry.Menu menu) {
					expanded.add(new Entry.Menu(menu.title(), menu.dependsOn(), menu.visibleIf(),
							expand(menu.entries()), menu.location()));
				}
				else if (entry instanceof Entry.Choice choice) {
					expanded.add(new Entry.Choice(choice.name(), choice.kind(), choice.prompt(), choice.defaults(),
							choice.dependsOn(), choice.optional(), choice.help(), expand(choice.entries()),
							choice.location()));
				}
				else if (entry instanceof Entry.If block) {
					expanded.add(new Entry.If(block.condition(), expand(block.entries()), block.location()));
				}
				else {
					expanded.add(entry);
				}
			}
			return expanded;
		}

		private Path target(String path) {
			Path target = Path.of(path);
			return (target.isAbsolute() ? target : sourceTree.resolve(target)).normalize();
		}

		private Path display(Path file) {
			return file.startsWith(sourceTree) ? sourceTree.relativize(file) : file;
		}
	}
}
