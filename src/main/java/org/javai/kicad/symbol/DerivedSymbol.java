package org.javai.kicad.symbol;

import java.util.List;
import java.util.Optional;
import org.javai.kicad.common.LibraryId;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.NamedBool;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.sexpr.Sexpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A symbol that inherits its body from another symbol in the same library and overrides
 * some of its fields.
 * <pre>
 * (symbol "id" (extends "parent")
 *   (power)? (pin_numbers ...)? (pin_names ...)? (exclude_from_sim b)?
 *   (in_bom b)? (on_board b)?
 *   property*
 *   (embedded_fonts b)?)
 * </pre>
 * The parent is held by name only; resolving it is up to the caller.
 *
 * @param parent name of the extended symbol
 */
public record DerivedSymbol(
		LibraryId id,
		String parent,
		Flag power,
		PinNumbers pinNumbers,
		PinNames pinNames,
		NamedBool excludeFromSim,
		NamedBool inBom,
		NamedBool onBoard,
		List<SymbolProperty> properties,
		NamedBool embeddedFonts
) implements SymbolDefinition {

	private static final Logger logger = LoggerFactory.getLogger(DerivedSymbol.class);

	public DerivedSymbol {
		if (id == null || parent == null) {
			throw new IllegalArgumentException("id and parent must not be null");
		}
		power = power != null ? power : Flag.absent();
		properties = properties != null ? List.copyOf(properties) : List.of();
	}

	/**
	 * Consumes the keyword and id and, if {@code (extends ...)} follows, parses the rest of
	 * {@code cursor} as a derived symbol. Otherwise returns empty, leaving {@code cursor}
	 * part-read; the caller falls back to a snapshot taken beforehand.
	 */
	static Optional<DerivedSymbol> readIfDerived(ListCursor cursor) {
		cursor.expectSymbolMatching("symbol");
		String id = cursor.expectString();
		if (!cursor.nextIsListNamed("extends")) {
			logger.trace("Symbol '{}' has no extends; parsing as root symbol", id);
			return Optional.empty();
		}
		return Optional.of(fromBody(LibraryId.read(id), cursor));
	}

	private static DerivedSymbol fromBody(LibraryId id, ListCursor cursor) {
		String parent = cursor.expectStringWithName("extends");
		Flag power = cursor.maybeFlag("power");
		PinNumbers pinNumbers = cursor.maybe(PinNumbers.TYPE).orElse(null);
		PinNames pinNames = cursor.maybe(PinNames.TYPE).orElse(null);
		NamedBool excludeFromSim = cursor.maybeNamedBool("exclude_from_sim").orElse(null);
		NamedBool inBom = cursor.maybeNamedBool("in_bom").orElse(null);
		NamedBool onBoard = cursor.maybeNamedBool("on_board").orElse(null);
		List<SymbolProperty> properties = cursor.expectMany(SymbolProperty.TYPE);
		NamedBool embeddedFonts = cursor.maybeNamedBool("embedded_fonts").orElse(null);
		cursor.expectEnd();
		return new DerivedSymbol(id, parent, power, pinNumbers, pinNames, excludeFromSim, inBom, onBoard,
				properties, embeddedFonts);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("symbol")
				.add(id)
				.add(Sexpr.stringWithName("extends", parent))
				.flag("power", power)
				.add(pinNumbers)
				.add(pinNames)
				.optionalBool("exclude_from_sim", excludeFromSim)
				.optionalBool("in_bom", inBom)
				.optionalBool("on_board", onBoard)
				.addAll(properties)
				.optionalBool("embedded_fonts", embeddedFonts)
				.build();
	}
}
