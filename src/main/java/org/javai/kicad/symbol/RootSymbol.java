package org.javai.kicad.symbol;

import java.util.List;
import org.javai.kicad.common.LibraryId;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.NamedBool;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.sexpr.Sexpr;

/**
 * A symbol with its own body. Children appear in this order:
 * <pre>
 * (symbol "id"
 *   (power)? (pin_numbers ...)? (pin_names ...)? (exclude_from_sim b)?
 *   (in_bom b) (on_board b)
 *   property* graphic-item* pin* sub-unit*
 *   (embedded_fonts b)?)
 * </pre>
 *
 * @param power {@code (power)}; marks a power-flag symbol
 * @param excludeFromSim {@code null} when absent (files before KiCad 7)
 * @param embeddedFonts {@code null} when absent (files before KiCad 8)
 */
public record RootSymbol(
		LibraryId id,
		Flag power,
		PinNumbers pinNumbers,
		PinNames pinNames,
		NamedBool excludeFromSim,
		NamedBool inBom,
		NamedBool onBoard,
		List<SymbolProperty> properties,
		List<GraphicItem> graphicItems,
		List<Pin> pins,
		List<SubUnit> units,
		NamedBool embeddedFonts
) implements SymbolDefinition {

	public RootSymbol {
		if (id == null || inBom == null || onBoard == null) {
			throw new IllegalArgumentException("id, inBom and onBoard must not be null");
		}
		power = power != null ? power : Flag.absent();
		properties = properties != null ? List.copyOf(properties) : List.of();
		graphicItems = graphicItems != null ? List.copyOf(graphicItems) : List.of();
		pins = pins != null ? List.copyOf(pins) : List.of();
		units = units != null ? List.copyOf(units) : List.of();
	}

	public static RootSymbol fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("symbol");
		LibraryId id = LibraryId.read(cursor.expectString());
		Flag power = cursor.maybeFlag("power");
		PinNumbers pinNumbers = cursor.maybe(PinNumbers.TYPE).orElse(null);
		PinNames pinNames = cursor.maybe(PinNames.TYPE).orElse(null);
		NamedBool excludeFromSim = cursor.maybeNamedBool("exclude_from_sim").orElse(null);
		NamedBool inBom = cursor.expectNamedBool("in_bom");
		NamedBool onBoard = cursor.expectNamedBool("on_board");
		List<SymbolProperty> properties = cursor.expectMany(SymbolProperty.TYPE);
		List<GraphicItem> graphicItems = cursor.expectMany(GraphicItem.TYPE);
		List<Pin> pins = cursor.expectMany(Pin.TYPE);
		List<SubUnit> units = cursor.expectMany(SubUnit.TYPE);
		NamedBool embeddedFonts = cursor.maybeNamedBool("embedded_fonts").orElse(null);
		cursor.expectEnd();
		return new RootSymbol(id, power, pinNumbers, pinNames, excludeFromSim, inBom, onBoard,
				properties, graphicItems, pins, units, embeddedFonts);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("symbol")
				.add(id)
				.flag("power", power)
				.add(pinNumbers)
				.add(pinNames)
				.optionalBool("exclude_from_sim", excludeFromSim)
				.add(inBom.toSexpr("in_bom"))
				.add(onBoard.toSexpr("on_board"))
				.addAll(properties)
				.addAll(graphicItems)
				.addAll(pins)
				.addAll(units)
				.optionalBool("embedded_fonts", embeddedFonts)
				.build();
	}
}
