package org.javai.kconfig.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.kconfig.KconfigLoadException;
import org.javai.kconfig.ast.Entry;
import org.javai.kconfig.ast.KconfigFile;
import org.javai.kconfig.parse.KconfigParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SourceResolverTest {

	private static final Path TREE = Path.of("/tree");

	@Mock
	private FileLoader loader;

	private SourceResolver resolver;

	@BeforeEach
	void setUp() {
		resolver = new SourceResolver(loader);
	}

	@Test
	void splicesSourcedEntriesInsideEnclosingBlock() throws IOException {
		when(loader.readFile(TREE.resolve("Kconfig"))).thenReturn("""
				mainmenu "Root"
				if NET
				source "net/Kconfig"
				endif
				config NET
					bool "Networking"
				""");
		when(loader.readFile(TREE.resolve("net/Kconfig"))).thenReturn("""
				config IPV6
					bool "IPv6"
				""");

		KconfigFile file = resolver.resolve(TREE.resolve("Kconfig"), TREE);

		assertThat(file.mainMenu()).isEqualTo("Root");
		assertThat(file.entries()).hasSize(2);
		Entry.If block = (Entry.If) file.entries().get(0);
		assertThat(block.entries()).hasSize(1);
		Entry.Config ipv6 = (Entry.Config) block.entries().get(0);
		assertThat(ipv6.name()).isEqualTo("IPV6");
		assertThat(ipv6.location()).isEqualTo(new Entry.Location("net/Kconfig", 1));
	}

	@Test
	void sourceCycleNamesFullChain() throws IOException {
		when(loader.readFile(TREE.resolve("A"))).thenReturn("source \"B\"\n");
		when(loader.readFile(TREE.resolve("B"))).thenReturn("source \"A\"\n");

		assertThatThrownBy(() -> resolver.resolve(TREE.resolve("A"), TREE))
				.isInstanceOf(SourceCycleException.class)
				.isInstanceOf(KconfigLoadException.class)
				.hasMessage("Source cycle detected: A -> B -> A")
				.satisfies(e -> assertThat(((SourceCycleException) e).chain())
						.containsExactly(Path.of("A"), Path.of("B"), Path.of("A")));
	}

	@Test
	void selfInclusionIsACycle() throws IOException {
		when(loader.readFile(TREE.resolve("Kconfig"))).thenReturn("menu \"M\"\nsource \"Kconfig\"\nendmenu\n");

		assertThatThrownBy(() -> resolver.resolve(TREE.resolve("Kconfig"), TREE))
				.isInstanceOf(SourceCycleException.class)
				.hasMessage("Source cycle detected: Kconfig -> Kconfig");
	}

	@Test
	void sameFileSourcedFromSiblingsIsNotACycle() throws IOException {
		when(loader.readFile(TREE.resolve("Kconfig"))).thenReturn("source \"b/Kconfig\"\nsource \"c/Kconfig\"\n");
		when(loader.readFile(TREE.resolve("b/Kconfig"))).thenReturn("source \"common/Kconfig\"\n");
		when(loader.readFile(TREE.resolve("c/Kconfig"))).thenReturn("source \"common/Kconfig\"\n");
		when(loader.readFile(TREE.resolve("common/Kconfig"))).thenReturn("comment \"shared\"\n");

		KconfigFile file = resolver.resolve(TREE.resolve("Kconfig"), TREE);

		assertThat(file.entries()).hasSize(2).allMatch(e -> e instanceof Entry.Comment);
		verify(loader, times(2)).readFile(TREE.resolve("common/Kconfig"));
	}

	@Test
	void absoluteSourcePathIgnoresSourceTree() throws IOException {
		when(loader.readFile(TREE.resolve("Kconfig"))).thenReturn("source \"/opt/extra/Kconfig\"\n");
		when(loader.readFile(Path.of("/opt/extra/Kconfig"))).thenReturn("config EXTRA\n\tbool\n");

		KconfigFile file = resolver.resolve(TREE.resolve("Kconfig"), TREE);

		Entry.Config extra = (Entry.Config) file.entries().get(0);
		assertThat(extra.location().file()).isEqualTo("/opt/extra/Kconfig");
	}

	@Test
	void readFailureOfSourcedFileNamesTheDirective() throws IOException {
		IOException cause = new IOException("No such file");
		when(loader.readFile(TREE.resolve("Kconfig"))).thenReturn("config A\n\tbool\nsource \"missing/Kconfig\"\n");
		when(loader.readFile(TREE.resolve("missing/Kconfig"))).thenThrow(cause);

		assertThatThrownBy(() -> resolver.resolve(TREE.resolve("Kconfig"), TREE))
				.isInstanceOf(KconfigLoadException.class)
				.hasMessage("Failed to read missing/Kconfig sourced at Kconfig:3")
				.hasCause(cause);
	}

	@Test
	void parseErrorInSourcedFileNamesThatFile() throws IOException {
		when(loader.readFile(TREE.resolve("Kconfig"))).thenReturn("source \"bad/Kconfig\"\n");
		when(loader.readFile(TREE.resolve("bad/Kconfig"))).thenReturn("config A\n\tbool\nendif\n");

		assertThatThrownBy(() -> resolver.resolve(TREE.resolve("Kconfig"), TREE))
				.isInstanceOf(KconfigParseException.class)
				.hasMessageStartingWith("bad/Kconfig:3:");
	}

	@Test
	void resolvesFromFileSystem(@TempDir Path tree) throws IOException {
		Files.createDirectories(tree.resolve("drivers"));
		Files.writeString(tree.resolve("Kconfig"), "menu \"Drivers\"\nsource \"drivers/Kconfig\"\nendmenu\n");
		Files.writeString(tree.resolve("drivers/Kconfig"), "config SERIAL\n\ttristate \"Serial\"\n");

		KconfigFile file = new SourceResolver().resolve(tree.resolve("Kconfig"), tree);

		Entry.Menu menu = (Entry.Menu) file.entries().get(0);
		assertThat(menu.entries()).extracting(e -> ((Entry.Config) e).name()).containsExactly("SERIAL");
	}
}
