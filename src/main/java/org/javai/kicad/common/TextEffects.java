package org.javai.kicad.common;

import java.util.ArrayList;
import java.util.List;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * {@code (effects (font ...) (justify ...)? hide?)}.
 *
 * @param justify justification keywords, or {@code null} when there is no {@code justify} node
 * @param hide bare {@code hide} in older files, {@code (hide yes)} in newer ones
 */
public record TextEffects(Font font, List<Justify> justify, Flag hide) implements ToSexpr {

	public static final SexprType<TextEffects> TYPE = SexprType.keyword("effects", TextEffects::fromSexpr);

	public TextEffects {
		if (font == null) {
			throw new IllegalArgumentException("font must not be null");
		}
		justify = justify != null ? List.copyOf(justify) : null;
		hide = hide != null ? hide : Flag.absent();
	}

	public static TextEffects ofSize(double height, double width) {
		return new TextEffects(Font.ofSize(height, width), null, Flag.absent());
	}

	public static TextEffects fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("effects");
		Font font = cursor.expect(Font::fromSexpr);
		List<Justify> justify = cursor.maybeListWithName("justify").map(TextEffects::justifyFromSexpr).orElse(null);
		Flag hide = cursor.maybeFlag("hide");
		cursor.expectEnd();
		return new TextEffects(font, justify, hide);
	}

	private static List<Justify> justifyFromSexpr(ListCursor cursor) {
		List<Justify> result = new ArrayList<>();
		while (cursor.hasNext()) {
			result.add(Justify.fromKeyword(cursor.expectSymbol()));
		}
		return result;
	}

	@Override
	public Sexpr toSexpr() {
		SexprBuilder builder = SexprBuilder.list("effects").add(font);
		if (justify != null) {
			SexprBuilder justifyNode = SexprBuilder.list("justify");
			for (Justify value : justify) {
				justifyNode.add(Sexpr.symbol(value.keyword()));
			}
			builder.add(justifyNode.build());
		}
		return builder.flag("hide", hide).build();
	}
}
