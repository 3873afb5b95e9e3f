package org.javai.kicad.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprReader;
import org.junit.jupiter.api.Test;

class SubUnitTest {

	private static SubUnit parse(Sexpr input) {
		return SubUnit.fromSexpr(new ListCursor((Sexpr.ListNode) input));
	}

	@Test
	void graphicsAreKeptVerbatim() {
		Sexpr input = SexprReader.read("(symbol \"Q_NPN_1_1\" (unit_name \"Body\") "
				+ "(circle (center 1.27 0) (radius 2.8194) (stroke (width 0.254) (type default)) (fill (type none))) "
				+ "(bezier (pts (xy 0 0) (xy 1 1) (xy 2 1) (xy 3 0)) (future_field 42)) "
				+ "(pin input line (at -5.08 0 0) (length 5.08) (name \"B\") (number \"1\")))");

		SubUnit unit = parse(input);

		assertThat(unit.id()).isEqualTo(new UnitId("Q_NPN", 1, 1));
		assertThat(unit.unitName()).isEqualTo("Body");
		assertThat(unit.graphicItems()).extracting(GraphicItem::kind).containsExactly("circle", "bezier");
		assertThat(unit.pins()).hasSize(1);
		assertThat(unit.toSexpr()).isEqualTo(input);
	}

	@Test
	void graphicAfterPinIsRejected() {
		Sexpr input = SexprReader.read("(symbol \"X_1_1\" (pin input line (at 0 0) (length 1) (name \"~\") "
				+ "(number \"1\")) (rectangle (start 0 0) (end 1 1)))");

		assertThatThrownBy(() -> parse(input))
				.isInstanceOf(KiCadParseException.class)
				.hasMessageStartingWith("Expected end of list but found (rectangle");
	}

	@Test
	void unknownGraphicIsNotAGraphicItem() {
		Sexpr.ListNode node = Sexpr.listWithName("hexagon", Sexpr.number(1));

		assertThat(GraphicItem.TYPE.isPresent(node)).isFalse();
		assertThatThrownBy(() -> new GraphicItem(node)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void badUnitNameCarriesItsInput() {
		assertThatThrownBy(() -> parse(SexprReader.read("(symbol \"Broken\")")))
				.isInstanceOf(KiCadParseException.class)
				.hasMessage("Malformed unit identifier 'Broken'");
	}
}
