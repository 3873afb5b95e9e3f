package org.javai.kicad.convert;

/**
 * The pair of words a named boolean was written with. KiCad writes {@code yes}/{@code no};
 * {@code true}/{@code false} are legal too and are written back as read.
 */
public enum BoolVocabulary {

	YES_NO("yes", "no"),
	TRUE_FALSE("true", "false");

	private final String trueWord;
	private final String falseWord;

	BoolVocabulary(String trueWord, String falseWord) {
		this.trueWord = trueWord;
		this.falseWord = falseWord;
	}

	public String word(boolean value) {
		return value ? trueWord : falseWord;
	}

	/**
	 * The vocabulary {@code text} belongs to, or {@code null} if it is not a boolean word.
	 */
	static BoolVocabulary of(CharSequence text) {
		for (BoolVocabulary vocabulary : values()) {
			if (vocabulary.trueWord.contentEquals(text) || vocabulary.falseWord.contentEquals(text)) {
				return vocabulary;
			}
		}
		return null;
	}
}
