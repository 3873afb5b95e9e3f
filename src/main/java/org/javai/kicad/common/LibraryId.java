package org.javai.kicad.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.javai.kicad.convert.KiCadParseError.LibraryIdMalformed;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * Identifies a symbol as {@code library:name}. The library nickname is omitted for
 * symbols defined inside a library file, where the file itself is the library.
 *
 * @param library library nickname, or {@code null}
 * @param name symbol name
 */
public record LibraryId(String library, String name) implements ToSexpr {

	public LibraryId {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("name must not be empty");
		}
		if (library != null && library.isEmpty()) {
			throw new IllegalArgumentException("library must be null or non-empty");
		}
	}

	public static LibraryId of(String name) {
		return new LibraryId(null, name);
	}

	/**
	 * Parses {@code [library:]name}.
	 *
	 * @throws LibraryIdParseException if the text is empty, has an empty part, or has more
	 * than one separator
	 */
	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static LibraryId parse(String text) {
		if (text == null || text.isEmpty()) {
			throw new LibraryIdParseException(text, "identifier is empty");
		}
		int colon = text.indexOf(':');
		if (colon < 0) {
			return new LibraryId(null, text);
		}
		if (text.indexOf(':', colon + 1) >= 0) {
			throw new LibraryIdParseException(text, "more than one ':' separator");
		}
		if (colon == 0) {
			throw new LibraryIdParseException(text, "library nickname is empty");
		}
		if (colon == text.length() - 1) {
			throw new LibraryIdParseException(text, "symbol name is empty");
		}
		return new LibraryId(text.substring(0, colon), text.substring(colon + 1));
	}

	/**
	 * Parses an identifier read from a document, reporting failure as a grammar error.
	 */
	public static LibraryId read(CharSequence text) {
		String input = text.toString();
		try {
			return parse(input);
		} catch (LibraryIdParseException e) {
			throw new KiCadParseException(new LibraryIdMalformed(input, e.getMessage()), e);
		}
	}

	@Override
	public Sexpr toSexpr() {
		return Sexpr.string(toString());
	}

	@JsonValue
	@Override
	public String toString() {
		return library != null ? library + ":" + name : name;
	}
}
