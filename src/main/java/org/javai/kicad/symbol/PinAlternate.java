package org.javai.kicad.symbol;

import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * An alternate function of a pin: {@code (alternate "name" electrical_type graphic_style)}.
 */
public record PinAlternate(String name, PinElectricalType electricalType, PinGraphicStyle graphicStyle)
		implements ToSexpr {

	public static final SexprType<PinAlternate> TYPE = SexprType.keyword("alternate", PinAlternate::fromSexpr);

	public static PinAlternate fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("alternate");
		String name = cursor.expectString();
		PinElectricalType electricalType = PinElectricalType.fromKeyword(cursor.expectSymbol());
		PinGraphicStyle graphicStyle = PinGraphicStyle.fromKeyword(cursor.expectSymbol());
		cursor.expectEnd();
		return new PinAlternate(name, electricalType, graphicStyle);
	}

	@Override
	public Sexpr toSexpr() {
		return Sexpr.listWithName("alternate",
				Sexpr.string(name),
				Sexpr.symbol(electricalType.keyword()),
				Sexpr.symbol(graphicStyle.keyword()));
	}
}
