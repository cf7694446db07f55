package org.javai.kconfig;

/**
 * Fatal error raised while loading a Kconfig tree. A load that throws never yields a
 * symbol table.
 */
public class KconfigLoadException extends RuntimeException {

	public KconfigLoadException(String message) {
		super(message);
	}

	public KconfigLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
