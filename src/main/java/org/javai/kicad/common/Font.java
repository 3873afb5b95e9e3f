package org.javai.kicad.common;

import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.Numbers;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * {@code (font (face "name")? (size height width) (thickness t)? bold? italic?)}.
 * <p>
 * {@code bold} and {@code italic} are bare keywords in older files and {@code (bold yes)}
 * in newer ones; the flag remembers which.
 */
public record Font(String face, double height, double width, Double thickness, Flag bold, Flag italic)
		implements ToSexpr {

	public Font {
		bold = bold != null ? bold : Flag.absent();
		italic = italic != null ? italic : Flag.absent();
	}

	public static Font ofSize(double height, double width) {
		return new Font(null, height, width, null, Flag.absent(), Flag.absent());
	}

	public static Font fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("font");
		String face = cursor.maybeStringWithName("face").orElse(null);
		ListCursor size = cursor.expectListWithName("size");
		double height = size.expectNumber();
		double width = size.expectNumber();
		size.expectEnd();
		Double thickness = Numbers.orNull(cursor.maybeNumberWithName("thickness"));
		Flag bold = cursor.maybeFlag("bold");
		Flag italic = cursor.maybeFlag("italic");
		cursor.expectEnd();
		return new Font(face, height, width, thickness, bold, italic);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("font")
				.optionalString("face", face)
				.add(Sexpr.listWithName("size", Sexpr.number(height), Sexpr.number(width)))
				.optionalNumber("thickness", thickness)
				.flag("bold", bold)
				.flag("italic", italic)
				.build();
	}
}
