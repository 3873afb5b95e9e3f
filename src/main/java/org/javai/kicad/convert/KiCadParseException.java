package org.javai.kicad.convert;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Exception thrown when a token tree does not match the grammar of the entity being parsed.
 * <p>
 * Carries the typed {@link KiCadParseError} and the path of enclosing entities, outermost
 * first. The path is filled in as the exception propagates out of nested
 * {@code expect} calls, so a failure deep inside a property reads
 * {@code kicad_symbol_lib > symbol > property: ...}.
 */
public class KiCadParseException extends RuntimeException {

	private final KiCadParseError error;
	private final Deque<String> path = new ArrayDeque<>();

	public KiCadParseException(KiCadParseError error) {
		super(error.message());
		this.error = error;
	}

	public KiCadParseException(KiCadParseError error, Throwable cause) {
		super(error.message(), cause);
		this.error = error;
	}

	public KiCadParseError error() {
		return error;
	}

	/**
	 * Enclosing entities, outermost first.
	 */
	public List<String> path() {
		return List.copyOf(path);
	}

	/**
	 * Records that the failure happened inside {@code entity}.
	 *
	 * @return this exception, for rethrowing
	 */
	public KiCadParseException prependPath(String entity) {
		path.addFirst(entity);
		return this;
	}

	@Override
	public String getMessage() {
		if (path.isEmpty()) {
			return error.message();
		}
		return String.join(" > ", path) + ": " + error.message();
	}
}
