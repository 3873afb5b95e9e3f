package org.javai.kicad.symbol.fast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.kicad.common.Font;
import org.javai.kicad.common.Justify;
import org.javai.kicad.common.Position;
import org.javai.kicad.common.TextEffects;
import org.javai.kicad.convert.BufferCursor;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.Numbers;
import org.javai.kicad.convert.SexprRefType;
import org.javai.kicad.sexpr.TextView;

/**
 * Borrowing-path parsers for the shared leaf entities.
 */
public final class FastCommonParser {

	public static final SexprRefType<TextEffects> TEXT_EFFECTS = SexprRefType.keyword("effects", FastCommonParser::textEffects);

	private FastCommonParser() {
	}

	public static Position position(BufferCursor cursor) {
		cursor.expectSymbolMatching("at");
		double x = cursor.expectNumber();
		double y = cursor.expectNumber();
		Double angle = Numbers.orNull(cursor.maybeNumber());
		cursor.expectEnd();
		return new Position(x, y, angle);
	}

	public static Font font(BufferCursor cursor) {
		cursor.expectSymbolMatching("font");
		String face = text(cursor.maybeStringWithName("face"));
		BufferCursor size = cursor.expectListWithName("size");
		double height = size.expectNumber();
		double width = size.expectNumber();
		size.expectEnd();
		Double thickness = Numbers.orNull(cursor.maybeNumberWithName("thickness"));
		Flag bold = cursor.maybeFlag("bold");
		Flag italic = cursor.maybeFlag("italic");
		cursor.expectEnd();
		return new Font(face, height, width, thickness, bold, italic);
	}

	public static TextEffects textEffects(BufferCursor cursor) {
		cursor.expectSymbolMatching("effects");
		Font font = cursor.expect(FastCommonParser::font);
		List<Justify> justify = null;
		Optional<BufferCursor> justifyList = cursor.maybeListWithName("justify");
		if (justifyList.isPresent()) {
			justify = new ArrayList<>();
			BufferCursor list = justifyList.get();
			while (list.hasNext()) {
				justify.add(Justify.fromKeyword(list.expectSymbol()));
			}
		}
		Flag hide = cursor.maybeFlag("hide");
		cursor.expectEnd();
		return new TextEffects(font, justify, hide);
	}

	static String text(Optional<TextView> view) {
		return view.map(TextView::toString).orElse(null);
	}
}
