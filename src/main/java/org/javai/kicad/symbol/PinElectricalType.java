package org.javai.kicad.symbol;

import com.fasterxml.jackson.annotation.JsonValue;
import org.javai.kicad.convert.KeywordEnum;

/**
 * Electrical type of a pin, the first keyword after {@code pin}.
 */
public enum PinElectricalType implements KeywordEnum {
	INPUT("input"),
	OUTPUT("output"),
	BIDIRECTIONAL("bidirectional"),
	TRI_STATE("tri_state"),
	PASSIVE("passive"),
	FREE("free"),
	UNSPECIFIED("unspecified"),
	POWER_IN("power_in"),
	POWER_OUT("power_out"),
	OPEN_COLLECTOR("open_collector"),
	OPEN_EMITTER("open_emitter"),
	NO_CONNECT("no_connect"),
	// KiCad 6 spelling of no_connect
	UNCONNECTED("unconnected");

	private final String keyword;

	PinElectricalType(String keyword) {
		this.keyword = keyword;
	}

	@JsonValue
	@Override
	public String keyword() {
		return keyword;
	}

	public static PinElectricalType fromKeyword(CharSequence text) {
		return KeywordEnum.fromKeyword(PinElectricalType.class, text, "pin electrical type");
	}
}
