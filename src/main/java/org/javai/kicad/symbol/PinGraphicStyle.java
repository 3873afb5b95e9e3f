package org.javai.kicad.symbol;

import com.fasterxml.jackson.annotation.JsonValue;
import org.javai.kicad.convert.KeywordEnum;

public enum PinGraphicStyle implements KeywordEnum {
	LINE("line"),
	INVERTED("inverted"),
	CLOCK("clock"),
	INVERTED_CLOCK("inverted_clock"),
	INPUT_LOW("input_low"),
	CLOCK_LOW("clock_low"),
	OUTPUT_LOW("output_low"),
	EDGE_CLOCK_HIGH("edge_clock_high"),
	NON_LOGIC("non_logic");

	private final String keyword;

	PinGraphicStyle(String keyword) {
		this.keyword = keyword;
	}

	@JsonValue
	@Override
	public String keyword() {
		return keyword;
	}

	public static PinGraphicStyle fromKeyword(CharSequence text) {
		return KeywordEnum.fromKeyword(PinGraphicStyle.class, text, "pin graphic style");
	}
}
