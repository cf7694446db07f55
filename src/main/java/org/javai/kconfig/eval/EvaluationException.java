package org.javai.kconfig.eval;

/**
 * Internal error during expression evaluation, such as a reference to a symbol that the
 * symbol table builder should already have rejected.
 */
public class EvaluationException extends IllegalStateException {

	public EvaluationException(String message) {
		super(message);
	}
}
