package org.javai.kicad.convert;

import org.javai.kicad.convert.KiCadParseError.InvalidEnumValue;

/**
 * An enum whose constants are written as bare keywords.
 */
public interface KeywordEnum {

	String keyword();

	/**
	 * Finds the constant spelled {@code text}.
	 *
	 * @param enumName name reported in {@link InvalidEnumValue}
	 * @throws KiCadParseException if no constant matches
	 */
	static <E extends Enum<E> & KeywordEnum> E fromKeyword(Class<E> type, CharSequence text, String enumName) {
		for (E constant : type.getEnumConstants()) {
			if (constant.keyword().contentEquals(text)) {
				return constant;
			}
		}
		throw new KiCadParseException(new InvalidEnumValue(text.toString(), enumName));
	}
}
