package org.javai.kicad.symbol;

import java.util.List;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * One unit/body-style section of a root symbol:
 * {@code (symbol "Parent_U_S" (unit_name "A")? graphic-item* pin*)}.
 */
public record SubUnit(UnitId id, String unitName, List<GraphicItem> graphicItems, List<Pin> pins) implements ToSexpr {

	public static final SexprType<SubUnit> TYPE = SexprType.keyword("symbol", SubUnit::fromSexpr);

	public SubUnit {
		graphicItems = graphicItems != null ? List.copyOf(graphicItems) : List.of();
		pins = pins != null ? List.copyOf(pins) : List.of();
	}

	public static SubUnit fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("symbol");
		UnitId id = UnitId.parse(cursor.expectString());
		String unitName = cursor.maybeStringWithName("unit_name").orElse(null);
		List<GraphicItem> graphicItems = cursor.expectMany(GraphicItem.TYPE);
		List<Pin> pins = cursor.expectMany(Pin.TYPE);
		cursor.expectEnd();
		return new SubUnit(id, unitName, graphicItems, pins);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("symbol")
				.add(id)
				.optionalString("unit_name", unitName)
				.addAll(graphicItems)
				.addAll(pins)
				.build();
	}
}
