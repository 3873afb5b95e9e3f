package org.javai.kicad.symbol;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * {@code (pin_numbers hide)} in KiCad 6, {@code (pin_numbers (hide yes))} from KiCad 8.
 */
public record PinNumbers(@JsonProperty("hide") Flag hide) implements ToSexpr {

	public static final SexprType<PinNumbers> TYPE = SexprType.keyword("pin_numbers", PinNumbers::fromSexpr);

	public PinNumbers {
		hide = hide != null ? hide : Flag.absent();
	}

	public static PinNumbers fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("pin_numbers");
		Flag hide = cursor.maybeFlag("hide");
		cursor.expectEnd();
		return new PinNumbers(hide);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("pin_numbers").flag("hide", hide).build();
	}
}
