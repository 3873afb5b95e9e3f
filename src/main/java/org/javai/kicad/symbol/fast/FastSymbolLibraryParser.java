package org.javai.kicad.symbol.fast;

import java.util.ArrayList;
import java.util.List;
import org.javai.kicad.common.LibraryId;
import org.javai.kicad.common.Position;
import org.javai.kicad.common.TextEffects;
import org.javai.kicad.convert.BufferCursor;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.KiCadParseError.UnexpectedEndOfList;
import org.javai.kicad.convert.KiCadParseError.UnexpectedSexprType;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.NamedBool;
import org.javai.kicad.convert.Numbers;
import org.javai.kicad.convert.SexprRefType;
import org.javai.kicad.intern.PropertyKeyInterner;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprBuffer;
import org.javai.kicad.sexpr.SexprKind;
import org.javai.kicad.symbol.DerivedSymbol;
import org.javai.kicad.symbol.Generator;
import org.javai.kicad.symbol.GraphicItem;
import org.javai.kicad.symbol.Pin;
import org.javai.kicad.symbol.PinAlternate;
import org.javai.kicad.symbol.PinElectricalType;
import org.javai.kicad.symbol.PinGraphicStyle;
import org.javai.kicad.symbol.PinNames;
import org.javai.kicad.symbol.PinNumbers;
import org.javai.kicad.symbol.PinText;
import org.javai.kicad.symbol.RootSymbol;
import org.javai.kicad.symbol.SubUnit;
import org.javai.kicad.symbol.SymbolDefinition;
import org.javai.kicad.symbol.SymbolLibraryFile;
import org.javai.kicad.symbol.SymbolProperty;
import org.javai.kicad.symbol.UnitId;

/**
 * Parses a symbol library straight from a {@link SexprBuffer}.
 * <p>
 * Produces the same model as {@link SymbolLibraryFile#fromSexpr} but never builds a
 * token tree: keywords are matched in place, property keys are interned from the arena
 * without an intermediate string. Only graphic items, which are kept as nodes, are
 * materialised.
 */
public final class FastSymbolLibraryParser {

	static final SexprRefType<SymbolDefinition> SYMBOL = SexprRefType.keyword("symbol", FastSymbolLibraryParser::symbolDefinition);
	static final SexprRefType<SymbolProperty> PROPERTY = SexprRefType.keyword("property", FastSymbolLibraryParser::property);
	static final SexprRefType<PinNumbers> PIN_NUMBERS = SexprRefType.keyword("pin_numbers", FastSymbolLibraryParser::pinNumbers);
	static final SexprRefType<PinNames> PIN_NAMES = SexprRefType.keyword("pin_names", FastSymbolLibraryParser::pinNames);
	static final SexprRefType<GraphicItem> GRAPHIC_ITEM = SexprRefType.keywords("graphic item", GraphicItem.KINDS, FastSymbolLibraryParser::graphicItem);
	static final SexprRefType<Pin> PIN = SexprRefType.keyword("pin", FastSymbolLibraryParser::pin);
	static final SexprRefType<PinAlternate> ALTERNATE = SexprRefType.keyword("alternate", FastSymbolLibraryParser::alternate);
	static final SexprRefType<SubUnit> SUB_UNIT = SexprRefType.keyword("symbol", FastSymbolLibraryParser::subUnit);

	private FastSymbolLibraryParser() {
	}

	/**
	 * Parses the buffer's root list as a symbol library.
	 *
	 * @throws KiCadParseException if the tree does not match the grammar
	 */
	public static SymbolLibraryFile parse(SexprBuffer buffer) {
		try {
			return libraryFile(BufferCursor.of(buffer));
		} catch (KiCadParseException e) {
			throw e.prependPath("kicad_symbol_lib");
		}
	}

	static SymbolLibraryFile libraryFile(BufferCursor cursor) {
		cursor.expectSymbolMatching("kicad_symbol_lib");
		int version = Numbers.toInt(cursor.expectNumberWithName("version"), "version");
		Generator generator = cursor.expect(FastSymbolLibraryParser::generator);
		String generatorVersion = FastCommonParser.text(cursor.maybeStringWithName("generator_version"));
		List<SymbolDefinition> symbols = cursor.expectMany(SYMBOL);
		cursor.expectEnd();
		return new SymbolLibraryFile(version, generator, generatorVersion, symbols);
	}

	static Generator generator(BufferCursor cursor) {
		cursor.expectSymbolMatching("generator");
		SexprKind kind = cursor.peekKind();
		if (kind == null) {
			throw new KiCadParseException(new UnexpectedEndOfList());
		}
		Generator generator;
		if (kind == SexprKind.STRING) {
			generator = new Generator.Quoted(cursor.expectString().toString());
		} else if (kind == SexprKind.SYMBOL) {
			generator = new Generator.Bare(cursor.expectSymbol().toString());
		} else {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.STRING));
		}
		cursor.expectEnd();
		return generator;
	}

	/**
	 * Reads keyword and id, then dispatches on whether the next child is {@code (extends ...)}.
	 * No backtracking is needed: the check inspects the buffer without consuming.
	 */
	static SymbolDefinition symbolDefinition(BufferCursor cursor) {
		cursor.expectSymbolMatching("symbol");
		LibraryId id = LibraryId.read(cursor.expectString());
		if (cursor.nextIsListNamed("extends")) {
			return derivedSymbol(id, cursor);
		}
		return rootSymbol(id, cursor);
	}

	private static RootSymbol rootSymbol(LibraryId id, BufferCursor cursor) {
		Flag power = cursor.maybeFlag("power");
		PinNumbers pinNumbers = cursor.maybe(PIN_NUMBERS).orElse(null);
		PinNames pinNames = cursor.maybe(PIN_NAMES).orElse(null);
		NamedBool excludeFromSim = cursor.maybeNamedBool("exclude_from_sim").orElse(null);
		NamedBool inBom = cursor.expectNamedBool("in_bom");
		NamedBool onBoard = cursor.expectNamedBool("on_board");
		List<SymbolProperty> properties = cursor.expectMany(PROPERTY);
		List<GraphicItem> graphicItems = cursor.expectMany(GRAPHIC_ITEM);
		List<Pin> pins = cursor.expectMany(PIN);
		List<SubUnit> units = cursor.expectMany(SUB_UNIT);
		NamedBool embeddedFonts = cursor.maybeNamedBool("embedded_fonts").orElse(null);
		cursor.expectEnd();
		return new RootSymbol(id, power, pinNumbers, pinNames, excludeFromSim, inBom, onBoard,
				properties, graphicItems, pins, units, embeddedFonts);
	}

	private static DerivedSymbol derivedSymbol(LibraryId id, BufferCursor cursor) {
		String parent = cursor.expectStringWithName("extends").toString();
		Flag power = cursor.maybeFlag("power");
		PinNumbers pinNumbers = cursor.maybe(PIN_NUMBERS).orElse(null);
		PinNames pinNames = cursor.maybe(PIN_NAMES).orElse(null);
		NamedBool excludeFromSim = cursor.maybeNamedBool("exclude_from_sim").orElse(null);
		NamedBool inBom = cursor.maybeNamedBool("in_bom").orElse(null);
		NamedBool onBoard = cursor.maybeNamedBool("on_board").orElse(null);
		List<SymbolProperty> properties = cursor.expectMany(PROPERTY);
		NamedBool embeddedFonts = cursor.maybeNamedBool("embedded_fonts").orElse(null);
		cursor.expectEnd();
		return new DerivedSymbol(id, parent, power, pinNumbers, pinNames, excludeFromSim, inBom, onBoard,
				properties, embeddedFonts);
	}

	static SymbolProperty property(BufferCursor cursor) {
		cursor.expectSymbolMatching("property");
		String key = PropertyKeyInterner.intern(cursor.expectString());
		String value = cursor.expectString().toString();
		Double legacyId = Numbers.orNull(cursor.maybeNumberWithName("id"));
		Position position = cursor.expect(FastCommonParser::position);
		Flag hide = cursor.maybeFlag("hide");
		Flag showName = cursor.maybeFlag("show_name");
		Flag doNotAutoplace = cursor.maybeFlag("do_not_autoplace");
		TextEffects effects = cursor.maybe(FastCommonParser.TEXT_EFFECTS).orElse(null);
		cursor.expectEnd();
		return new SymbolProperty(key, value, legacyId, position, hide, showName, doNotAutoplace, effects);
	}

	static PinNumbers pinNumbers(BufferCursor cursor) {
		cursor.expectSymbolMatching("pin_numbers");
		Flag hide = cursor.maybeFlag("hide");
		cursor.expectEnd();
		return new PinNumbers(hide);
	}

	static PinNames pinNames(BufferCursor cursor) {
		cursor.expectSymbolMatching("pin_names");
		Double offset = Numbers.orNull(cursor.maybeNumberWithName("offset"));
		Flag hide = cursor.maybeFlag("hide");
		cursor.expectEnd();
		return new PinNames(offset, hide);
	}

	static SubUnit subUnit(BufferCursor cursor) {
		cursor.expectSymbolMatching("symbol");
		UnitId id = UnitId.parse(cursor.expectString().toString());
		String unitName = FastCommonParser.text(cursor.maybeStringWithName("unit_name"));
		List<GraphicItem> graphicItems = cursor.expectMany(GRAPHIC_ITEM);
		List<Pin> pins = cursor.expectMany(PIN);
		cursor.expectEnd();
		return new SubUnit(id, unitName, graphicItems, pins);
	}

	static GraphicItem graphicItem(BufferCursor cursor) {
		List<Sexpr> children = new ArrayList<>();
		while (cursor.hasNext()) {
			children.add(cursor.next().toSexpr());
		}
		return new GraphicItem(Sexpr.list(children));
	}

	static Pin pin(BufferCursor cursor) {
		cursor.expectSymbolMatching("pin");
		PinElectricalType electricalType = PinElectricalType.fromKeyword(cursor.expectSymbol());
		PinGraphicStyle graphicStyle = PinGraphicStyle.fromKeyword(cursor.expectSymbol());
		Position position = cursor.expect(FastCommonParser::position);
		double length = cursor.expectNumberWithName("length");
		Flag hide = cursor.maybeFlag("hide");
		PinText name = cursor.expect(c -> pinText(c, "name"));
		PinText number = cursor.expect(c -> pinText(c, "number"));
		List<PinAlternate> alternates = cursor.expectMany(ALTERNATE);
		cursor.expectEnd();
		return new Pin(electricalType, graphicStyle, position, length, hide, name, number, alternates);
	}

	static PinText pinText(BufferCursor cursor, String keyword) {
		cursor.expectSymbolMatching(keyword);
		String text = cursor.expectString().toString();
		TextEffects effects = cursor.maybe(FastCommonParser.TEXT_EFFECTS).orElse(null);
		cursor.expectEnd();
		return new PinText(text, effects);
	}

	static PinAlternate alternate(BufferCursor cursor) {
		cursor.expectSymbolMatching("alternate");
		String name = cursor.expectString().toString();
		PinElectricalType electricalType = PinElectricalType.fromKeyword(cursor.expectSymbol());
		PinGraphicStyle graphicStyle = PinGraphicStyle.fromKeyword(cursor.expectSymbol());
		cursor.expectEnd();
		return new PinAlternate(name, electricalType, graphicStyle);
	}
}
