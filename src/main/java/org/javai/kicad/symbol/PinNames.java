package org.javai.kicad.symbol;

import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.Numbers;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * {@code (pin_names (offset n)? hide?)}, with {@code hide} as a bare keyword (KiCad 6)
 * or {@code (hide yes)} (KiCad 8).
 */
public record PinNames(Double offset, Flag hide) implements ToSexpr {

	public static final SexprType<PinNames> TYPE = SexprType.keyword("pin_names", PinNames::fromSexpr);

	public PinNames {
		hide = hide != null ? hide : Flag.absent();
	}

	public static PinNames fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("pin_names");
		Double offset = Numbers.orNull(cursor.maybeNumberWithName("offset"));
		Flag hide = cursor.maybeFlag("hide");
		cursor.expectEnd();
		return new PinNames(offset, hide);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("pin_names")
				.optionalNumber("offset", offset)
				.flag("hide", hide)
				.build();
	}
}
