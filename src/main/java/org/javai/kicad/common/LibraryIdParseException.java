package org.javai.kicad.common;

/**
 * Thrown when text is not a valid {@code [library:]name} identifier.
 */
public class LibraryIdParseException extends RuntimeException {

	private final String input;

	public LibraryIdParseException(String input, String reason) {
		super(reason);
		this.input = input;
	}

	public String input() {
		return input;
	}
}
