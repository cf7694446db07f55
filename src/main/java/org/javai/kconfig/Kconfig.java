package org.javai.kconfig;

import java.nio.file.Path;
import java.util.Objects;
import org.javai.kconfig.ast.KconfigFile;
import org.javai.kconfig.settings.KconfigSettings;
import org.javai.kconfig.source.FileLoader;
import org.javai.kconfig.source.FileSystemLoader;
import org.javai.kconfig.source.SourceResolver;
import org.javai.kconfig.symbol.DependencyResolver;
import org.javai.kconfig.symbol.SymbolTable;
import org.javai.kconfig.symbol.SymbolTableBuilder;

/**
 * A loaded Kconfig tree: the resolved AST, its symbol table and the resolver that owns
 * all changes to it.
 * <p>
 * Example usage:
 *
 * <pre>
 * Kconfig kconfig = Kconfig.load(Path.of("Kconfig"), Path.of("."));
 * SetResult result = kconfig.resolver().set("NET", Tristate.Y);
 * </pre>
 *
 * Loading again yields a new, independent instance; tables are never rebuilt in place.
 */
public final class Kconfig {

	private final KconfigFile ast;
	private final SymbolTable symbols;
	private final DependencyResolver resolver;

	private Kconfig(KconfigFile ast, SymbolTable symbols) {
		this.ast = ast;
		this.symbols = symbols;
		this.resolver = new DependencyResolver(symbols);
	}

	/**
	 * Loads from the file system with default build options.
	 *
	 * @throws KconfigLoadException if loading fails for any reason
	 */
	public static Kconfig load(Path kconfigFile, Path sourceTree) {
		return load(kconfigFile, sourceTree, new FileSystemLoader(), false);
	}

	/**
	 * Loads the tree named by the settings, honoring their build options.
	 */
	public static Kconfig load(KconfigSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		return load(settings.kconfig(), settings.srctree(), new FileSystemLoader(), settings.strictSelectCycles());
	}

	/**
	 * @param loader reads each Kconfig file
	 * @param strictSelectCycles whether a select/imply cycle is a load error
	 */
	public static Kconfig load(Path kconfigFile, Path sourceTree, FileLoader loader, boolean strictSelectCycles) {
		KconfigFile ast = new SourceResolver(loader).resolve(kconfigFile, sourceTree);
		SymbolTable symbols = new SymbolTableBuilder()
				.strictSelectCycles(strictSelectCycles)
				.build(ast);
		return new Kconfig(ast, symbols);
	}

	/**
	 * Builds directly from an already resolved tree.
	 */
	public static Kconfig of(KconfigFile ast) {
		Objects.requireNonNull(ast, "ast must not be null");
		return new Kconfig(ast, new SymbolTableBuilder().build(ast));
	}

	public KconfigFile ast() {
		return ast;
	}

	public SymbolTable symbols() {
		return symbols;
	}

	public DependencyResolver resolver() {
		return resolver;
	}
}
