package org.javai.kicad.common;

import com.fasterxml.jackson.annotation.JsonValue;
import org.javai.kicad.convert.KeywordEnum;

/**
 * Text justification keywords inside {@code (justify ...)}.
 */
public enum Justify implements KeywordEnum {
	LEFT("left"),
	RIGHT("right"),
	TOP("top"),
	BOTTOM("bottom"),
	MIRROR("mirror");

	private final String keyword;

	Justify(String keyword) {
		this.keyword = keyword;
	}

	@JsonValue
	@Override
	public String keyword() {
		return keyword;
	}

	public static Justify fromKeyword(CharSequence text) {
		return KeywordEnum.fromKeyword(Justify.class, text, "justify");
	}
}
