package org.javai.kicad.symbol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.javai.kicad.convert.KiCadParseError.UnitIdMalformed;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * Name of a sub-unit, {@code Parent_unit_style}. The parent name may itself contain
 * underscores, so the two numbers are taken from the end.
 *
 * @param parentName name of the enclosing symbol, without library nickname
 * @param unit unit number, 0 for items shared by all units
 * @param style body style, 0 for items shared by all styles
 */
public record UnitId(String parentName, int unit, int style) implements ToSexpr {

	/**
	 * @throws KiCadParseException with {@link UnitIdMalformed} if the text has no
	 * {@code _unit_style} suffix or the parent name is empty
	 */
	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static UnitId parse(String input) {
		int styleSeparator = input.lastIndexOf('_');
		int unitSeparator = styleSeparator > 0 ? input.lastIndexOf('_', styleSeparator - 1) : -1;
		if (unitSeparator <= 0) {
			throw new KiCadParseException(new UnitIdMalformed(input));
		}
		try {
			int unit = Integer.parseInt(input.substring(unitSeparator + 1, styleSeparator));
			int style = Integer.parseInt(input.substring(styleSeparator + 1));
			return new UnitId(input.substring(0, unitSeparator), unit, style);
		} catch (NumberFormatException e) {
			throw new KiCadParseException(new UnitIdMalformed(input), e);
		}
	}

	@Override
	public Sexpr toSexpr() {
		return Sexpr.string(toString());
	}

	@JsonValue
	@Override
	public String toString() {
		return parentName + "_" + unit + "_" + style;
	}
}
