package org.javai.kconfig.parse;

import org.javai.kconfig.KconfigLoadException;

/**
 * Exception thrown when Kconfig source text is lexically or syntactically invalid.
 */
public class KconfigParseException extends KconfigLoadException {

	private final String file;
	private final int line;
	private final String token;

	public KconfigParseException(String file, int line, String token, String message) {
		super(format(file, line, token, message));
		this.file = file;
		this.line = line;
		this.token = token;
	}

	public String file() {
		return file;
	}

	public int line() {
		return line;
	}

	/**
	 * The offending token text, {@code null} when the error is not tied to one.
	 */
	public String token() {
		return token;
	}

	private static String format(String file, int line, String token, String message) {
		String where = file + ":" + line + ": " + message;
		return token != null ? where + " (near '" + token + "')" : where;
	}
}
