package org.javai.kicad.convert;

import org.javai.kicad.sexpr.Sexpr;

/**
 * The value of a {@code (keyword yes|no)} field together with the words it was read with.
 */
public record NamedBool(boolean value, BoolVocabulary vocabulary) {

	public NamedBool {
		if (vocabulary == null) {
			throw new IllegalArgumentException("vocabulary must not be null");
		}
	}

	/**
	 * A value spelled the way KiCad writes it.
	 */
	public static NamedBool of(boolean value) {
		return new NamedBool(value, BoolVocabulary.YES_NO);
	}

	public Sexpr toSexpr(String keyword) {
		return Sexpr.symbolWithName(keyword, vocabulary.word(value));
	}
}
