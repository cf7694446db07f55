package org.javai.kconfig.ast;

import java.util.List;

/**
 * Parsed contents of a Kconfig file, or of a whole tree once {@code source} directives
 * have been spliced in.
 *
 * @param mainMenu the {@code mainmenu} title, {@code null} if the file declares none
 * @param entries top-level entries in order
 */
public record KconfigFile(String mainMenu, List<Entry> entries) {

	public KconfigFile {
		entries = entries != null ? List.copyOf(entries) : List.of();
	}
}
