package org.javai.kicad.symbol;

import java.util.List;
import org.javai.kicad.common.Position;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * A symbol pin.
 * <pre>
 * (pin passive line (at 0 3.81 270) (length 1.27) hide?
 *   (name "~" (effects ...))
 *   (number "1" (effects ...))
 *   (alternate ...)*)
 * </pre>
 * {@code hide} is a bare keyword in KiCad 6 and {@code (hide yes)} from KiCad 8.
 */
public record Pin(
		PinElectricalType electricalType,
		PinGraphicStyle graphicStyle,
		Position position,
		double length,
		Flag hide,
		PinText name,
		PinText number,
		List<PinAlternate> alternates
) implements ToSexpr {

	public static final SexprType<Pin> TYPE = SexprType.keyword("pin", Pin::fromSexpr);

	public Pin {
		hide = hide != null ? hide : Flag.absent();
		alternates = alternates != null ? List.copyOf(alternates) : List.of();
	}

	public static Pin fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("pin");
		PinElectricalType electricalType = PinElectricalType.fromKeyword(cursor.expectSymbol());
		PinGraphicStyle graphicStyle = PinGraphicStyle.fromKeyword(cursor.expectSymbol());
		Position position = cursor.expect(Position::fromSexpr);
		double length = cursor.expectNumberWithName("length");
		Flag hide = cursor.maybeFlag("hide");
		PinText name = cursor.expect(c -> PinText.fromSexpr(c, "name"));
		PinText number = cursor.expect(c -> PinText.fromSexpr(c, "number"));
		List<PinAlternate> alternates = cursor.expectMany(PinAlternate.TYPE);
		cursor.expectEnd();
		return new Pin(electricalType, graphicStyle, position, length, hide, name, number, alternates);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("pin")
				.add(Sexpr.symbol(electricalType.keyword()))
				.add(Sexpr.symbol(graphicStyle.keyword()))
				.add(position)
				.add(Sexpr.numberWithName("length", length))
				.flag("hide", hide)
				.add(name.toSexpr("name"))
				.add(number.toSexpr("number"))
				.addAll(alternates)
				.build();
	}
}
