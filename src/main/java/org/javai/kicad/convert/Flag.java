package org.javai.kicad.convert;

import org.javai.kicad.sexpr.Sexpr;

/**
 * A boolean field together with the spelling it was read from, so it can be written
 * back the same way.
 *
 * @param value the logical value
 * @param spelling how the value appeared in the source
 * @param vocabulary the words of a {@link Spelling#NAMED} flag; always {@code YES_NO} otherwise
 */
public record Flag(boolean value, Spelling spelling, BoolVocabulary vocabulary) {

	public enum Spelling {
		/** No node at all; the value is false. */
		ABSENT,
		/** A bare symbol such as {@code hide}. */
		KEYWORD,
		/** A list holding only its name, such as {@code (show_name)}. */
		EMPTY_LIST,
		/** A named boolean such as {@code (hide yes)}. */
		NAMED
	}

	private static final Flag ABSENT = new Flag(false, Spelling.ABSENT);

	public Flag(boolean value, Spelling spelling) {
		this(value, spelling, BoolVocabulary.YES_NO);
	}

	public Flag {
		if (spelling == null) {
			throw new IllegalArgumentException("spelling must not be null");
		}
		if (spelling == Spelling.ABSENT && value) {
			throw new IllegalArgumentException("an absent flag cannot be set");
		}
		if ((spelling == Spelling.KEYWORD || spelling == Spelling.EMPTY_LIST) && !value) {
			throw new IllegalArgumentException(spelling + " spelling always means true");
		}
		if (vocabulary == null || spelling != Spelling.NAMED) {
			vocabulary = BoolVocabulary.YES_NO;
		}
	}

	public static Flag absent() {
		return ABSENT;
	}

	public static Flag keyword() {
		return new Flag(true, Spelling.KEYWORD);
	}

	public static Flag emptyList() {
		return new Flag(true, Spelling.EMPTY_LIST);
	}

	public static Flag named(boolean value) {
		return new Flag(value, Spelling.NAMED);
	}

	public static Flag named(NamedBool value) {
		return new Flag(value.value(), Spelling.NAMED, value.vocabulary());
	}

	/**
	 * The node this flag was read from, or {@code null} when it contributes none.
	 */
	public Sexpr toSexpr(String keyword) {
		return switch (spelling) {
			case ABSENT -> null;
			case KEYWORD -> Sexpr.symbol(keyword);
			case EMPTY_LIST -> Sexpr.listWithName(keyword);
			case NAMED -> Sexpr.symbolWithName(keyword, vocabulary.word(value));
		};
	}
}
