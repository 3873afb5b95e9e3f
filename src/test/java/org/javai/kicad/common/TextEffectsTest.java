package org.javai.kicad.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.KiCadParseError.InvalidEnumValue;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprReader;
import org.junit.jupiter.api.Test;

class TextEffectsTest {

	private static ListCursor cursor(String text) {
		return new ListCursor((Sexpr.ListNode) SexprReader.read(text));
	}

	@Test
	void legacyEffectsWithBareHide() {
		Sexpr input = SexprReader.read("(effects (font (size 1.27 1.27)) hide)");

		TextEffects effects = TextEffects.fromSexpr(new ListCursor((Sexpr.ListNode) input));

		assertThat(effects.font()).isEqualTo(Font.ofSize(1.27, 1.27));
		assertThat(effects.justify()).isNull();
		assertThat(effects.hide()).isEqualTo(Flag.keyword());
		assertThat(effects.toSexpr()).isEqualTo(input);
	}

	@Test
	void currentEffectsWithNamedHideAndJustify() {
		Sexpr input = SexprReader.read("(effects (font (size 1.27 1.27)) (justify left bottom) (hide yes))");

		TextEffects effects = TextEffects.fromSexpr(new ListCursor((Sexpr.ListNode) input));

		assertThat(effects.justify()).containsExactly(Justify.LEFT, Justify.BOTTOM);
		assertThat(effects.hide()).isEqualTo(Flag.named(true));
		assertThat(effects.toSexpr()).isEqualTo(input);
	}

	@Test
	void fontWithFaceThicknessAndStyles() {
		Sexpr input = SexprReader.read("(font (face \"KiCad Font\") (size 2 1.5) (thickness 0.3) bold (italic yes))");

		Font font = Font.fromSexpr(new ListCursor((Sexpr.ListNode) input));

		assertThat(font.face()).isEqualTo("KiCad Font");
		assertThat(font.height()).isEqualTo(2.0);
		assertThat(font.width()).isEqualTo(1.5);
		assertThat(font.thickness()).isEqualTo(0.3);
		assertThat(font.bold()).isEqualTo(Flag.keyword());
		assertThat(font.italic()).isEqualTo(Flag.named(true));
		assertThat(font.toSexpr()).isEqualTo(input);
	}

	@Test
	void unknownJustificationIsInvalidEnumValue() {
		assertThatThrownBy(() -> TextEffects.fromSexpr(cursor("(effects (font (size 1 1)) (justify sideways))")))
				.isInstanceOf(KiCadParseException.class)
				.satisfies(e -> assertThat(((KiCadParseException) e).error())
						.isEqualTo(new InvalidEnumValue("sideways", "justify")));
	}

	@Test
	void fontErrorsNameTheFont() {
		assertThatThrownBy(() -> TextEffects.fromSexpr(cursor("(effects (font (size 1)))")))
				.isInstanceOf(KiCadParseException.class)
				.hasMessage("font: Unexpected end of list");
	}

	@Test
	void positionAngleIsOptional() {
		Position withAngle = Position.fromSexpr(cursor("(at 0 -3.81 90)"));
		Position withoutAngle = Position.fromSexpr(cursor("(at 1.5 2)"));

		assertThat(withAngle).isEqualTo(new Position(0, -3.81, 90.0));
		assertThat(withoutAngle.angle()).isNull();
		assertThat(withoutAngle.toSexpr()).isEqualTo(SexprReader.read("(at 1.5 2)"));
		assertThat(withAngle.toSexpr()).isEqualTo(SexprReader.read("(at 0 -3.81 90)"));
	}

	@Test
	void justifyListIsCopied() {
		TextEffects effects = new TextEffects(Font.ofSize(1, 1), new ArrayList<>(List.of(Justify.MIRROR)), null);

		assertThat(effects.hide()).isEqualTo(Flag.absent());
		assertThatThrownBy(() -> effects.justify().add(Justify.LEFT))
				.isInstanceOf(UnsupportedOperationException.class);
	}
}
