package org.javai.kicad.common;

import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.Numbers;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * {@code (at x y angle?)}.
 *
 * @param angle rotation in degrees, or {@code null} when the source omits it
 */
public record Position(double x, double y, Double angle) implements ToSexpr {

	public static final SexprType<Position> TYPE = SexprType.keyword("at", Position::fromSexpr);

	public static Position fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("at");
		double x = cursor.expectNumber();
		double y = cursor.expectNumber();
		Double angle = Numbers.orNull(cursor.maybeNumber());
		cursor.expectEnd();
		return new Position(x, y, angle);
	}

	@Override
	public Sexpr toSexpr() {
		SexprBuilder builder = SexprBuilder.list("at")
				.add(Sexpr.number(x))
				.add(Sexpr.number(y));
		if (angle != null) {
			builder.add(Sexpr.number(angle));
		}
		return builder.build();
	}
}
