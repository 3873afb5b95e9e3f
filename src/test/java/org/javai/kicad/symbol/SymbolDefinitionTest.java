package org.javai.kicad.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.apache.logging.log4j.Level;
import org.javai.kicad.common.LibraryId;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.KiCadParseError.UnexpectedSexprType;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.NamedBool;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprKind;
import org.javai.kicad.sexpr.SexprReader;
import org.javai.kicad.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class SymbolDefinitionTest {

	private static final String PROPERTY = " (property \"Value\" \"R\" (at 0 0 0))";

	private static SymbolDefinition parse(String text) {
		return SymbolDefinition.fromSexpr(new ListCursor((Sexpr.ListNode) SexprReader.read(text)));
	}

	@Test
	void extendsMakesADerivedSymbol() {
		SymbolDefinition symbol = parse("(symbol \"Device:R\" (extends \"Base\"))");

		assertThat(symbol).isInstanceOf(DerivedSymbol.class);
		DerivedSymbol derived = (DerivedSymbol) symbol;
		assertThat(derived.id()).isEqualTo(new LibraryId("Device", "R"));
		assertThat(derived.parent()).isEqualTo("Base");
		assertThat(derived.inBom()).isNull();
		assertThat(derived.onBoard()).isNull();
	}

	@Test
	void noExtendsMakesARootSymbol() {
		SymbolDefinition symbol = parse("(symbol \"Device:R\" (in_bom yes) (on_board yes))");

		assertThat(symbol).isInstanceOf(RootSymbol.class);
		assertThat(symbol.id()).isEqualTo(new LibraryId("Device", "R"));
	}

	@Test
	void propertyCountDoesNotAffectTheVariant() {
		StringBuilder properties = new StringBuilder();
		for (int i = 0; i < 25; i++) {
			properties.append(PROPERTY);
		}

		SymbolDefinition derived = parse("(symbol \"R_Small\" (extends \"R\")" + properties + ")");
		SymbolDefinition root = parse("(symbol \"R\" (in_bom yes) (on_board yes)" + properties + ")");

		assertThat(derived).isInstanceOf(DerivedSymbol.class);
		assertThat(derived.properties()).hasSize(25);
		assertThat(root).isInstanceOf(RootSymbol.class);
		assertThat(root.properties()).hasSize(25);
	}

	@Test
	void rootSymbolIsParsedFromASnapshot() {
		ListCursor cursor = new ListCursor((Sexpr.ListNode) SexprReader.read("(symbol \"R\" (in_bom no) (on_board yes))"));

		SymbolDefinition symbol = SymbolDefinition.fromSexpr(cursor);

		assertThat(symbol).isEqualTo(new RootSymbol(LibraryId.of("R"), Flag.absent(), null, null, null,
				NamedBool.of(false), NamedBool.of(true), null, null, null, null, null));
		assertThat(cursor.nextIsListNamed("in_bom")).isTrue();
	}

	@Test
	void derivedSymbolContinuesOnTheLiveCursor() {
		ListCursor cursor = spy(new ListCursor((Sexpr.ListNode) SexprReader.read(
				"(symbol \"R_Small\" (extends \"R\") (in_bom yes)" + PROPERTY + ")")));

		SymbolDefinition symbol = SymbolDefinition.fromSexpr(cursor);

		assertThat(symbol).isInstanceOf(DerivedSymbol.class);
		assertThat(symbol.properties()).hasSize(1);
		verify(cursor, times(1)).expectSymbolMatching("symbol");
		verify(cursor, times(1)).expectString();
		assertThat(cursor.hasNext()).isFalse();
	}

	@Test
	void rootFallbackIsTraced() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(DerivedSymbol.class, Level.TRACE)) {
			parse("(symbol \"Device:R\" (in_bom yes) (on_board yes))");
			parse("(symbol \"R_Small\" (extends \"R\"))");

			assertThat(captor.messagesAt(Level.TRACE))
					.containsExactly("Symbol 'Device:R' has no extends; parsing as root symbol");
		}
	}

	@Test
	void derivedSymbolWithOverrides() {
		Sexpr input = SexprReader.read("(symbol \"LED_Small\" (extends \"LED\") (power) (pin_numbers (hide yes)) "
				+ "(exclude_from_sim no) (in_bom yes) (on_board no)" + PROPERTY + " (embedded_fonts no))");

		DerivedSymbol derived = (DerivedSymbol) SymbolDefinition.fromSexpr(new ListCursor((Sexpr.ListNode) input));

		assertThat(derived.power()).isEqualTo(Flag.emptyList());
		assertThat(derived.pinNumbers()).isEqualTo(new PinNumbers(Flag.named(true)));
		assertThat(derived.excludeFromSim()).isEqualTo(NamedBool.of(false));
		assertThat(derived.inBom()).isEqualTo(NamedBool.of(true));
		assertThat(derived.onBoard()).isEqualTo(NamedBool.of(false));
		assertThat(derived.embeddedFonts()).isEqualTo(NamedBool.of(false));
		assertThat(derived.toSexpr()).isEqualTo(input);
	}

	@Test
	void derivedSymbolRejectsABody() {
		String text = "(symbol \"R_Small\" (extends \"R\") (pin passive line (at 0 0 0) (length 1) "
				+ "(name \"~\") (number \"1\")))";

		assertThatThrownBy(() -> parse(text))
				.isInstanceOf(KiCadParseException.class)
				.hasMessageStartingWith("Expected end of list");
	}

	@Test
	void extendsNeedsAString() {
		assertThatThrownBy(() -> parse("(symbol \"R_Small\" (extends R))"))
				.isInstanceOfSatisfying(KiCadParseException.class,
						e -> assertThat(e.error()).isEqualTo(new UnexpectedSexprType(SexprKind.STRING)));
	}

	@Test
	void rootSymbolWithZeroPropertiesAndUnitsRoundTrips() {
		Sexpr input = SexprReader.read("(symbol \"X\" (in_bom no) (on_board no))");

		SymbolDefinition symbol = SymbolDefinition.fromSexpr(new ListCursor((Sexpr.ListNode) input));

		assertThat(symbol.toSexpr()).isEqualTo(input);
	}

	@Test
	void trueFalseWordsAreWrittenBack() {
		Sexpr root = SexprReader.read("(symbol \"Device:R\" (in_bom true) (on_board false))");
		Sexpr derived = SexprReader.read("(symbol \"R_Small\" (extends \"R\") (pin_numbers (hide true)) "
				+ "(exclude_from_sim false) (embedded_fonts true))");

		assertThat(SymbolDefinition.fromSexpr(new ListCursor((Sexpr.ListNode) root)).toSexpr()).isEqualTo(root);
		assertThat(SymbolDefinition.fromSexpr(new ListCursor((Sexpr.ListNode) derived)).toSexpr()).isEqualTo(derived);
	}
}
