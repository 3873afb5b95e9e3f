package org.javai.kicad.convert;

import java.util.OptionalDouble;
import org.javai.kicad.convert.KiCadParseError.InvalidInteger;

/**
 * Conversions between parsed numbers and model field types.
 */
public final class Numbers {

	private Numbers() {
	}

	/**
	 * Boxes a present value; an empty optional becomes {@code null}, the absent
	 * representation of optional numeric fields.
	 */
	public static Double orNull(OptionalDouble value) {
		return value.isPresent() ? value.getAsDouble() : null;
	}

	/**
	 * Narrows a number that must be a whole {@code int}, such as a version date.
	 *
	 * @param field the field name reported when {@code value} has a fraction or does not fit
	 * @throws KiCadParseException if {@code value} is not a whole number in {@code int} range
	 */
	public static int toInt(double value, String field) {
		if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw new KiCadParseException(new InvalidInteger(value, field));
		}
		return (int) value;
	}
}
