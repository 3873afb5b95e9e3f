package org.javai.kicad.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.kicad.common.Position;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.KiCadParseError.InvalidEnumValue;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprReader;
import org.junit.jupiter.api.Test;

class PinTest {

	private static Pin parse(Sexpr input) {
		return Pin.fromSexpr(new ListCursor((Sexpr.ListNode) input));
	}

	@Test
	void legacyPinWithBareHide() {
		Sexpr input = SexprReader.read("(pin power_in line (at 0 0 270) (length 0) hide "
				+ "(name \"GND\" (effects (font (size 1.27 1.27)))) "
				+ "(number \"1\" (effects (font (size 1.27 1.27)))))");

		Pin pin = parse(input);

		assertThat(pin.electricalType()).isEqualTo(PinElectricalType.POWER_IN);
		assertThat(pin.graphicStyle()).isEqualTo(PinGraphicStyle.LINE);
		assertThat(pin.position()).isEqualTo(new Position(0, 0, 270.0));
		assertThat(pin.length()).isZero();
		assertThat(pin.hide()).isEqualTo(Flag.keyword());
		assertThat(pin.name().text()).isEqualTo("GND");
		assertThat(pin.number().text()).isEqualTo("1");
		assertThat(pin.toSexpr()).isEqualTo(input);
	}

	@Test
	void currentPinWithNamedHide() {
		Sexpr input = SexprReader.read("(pin power_in line (at 0 0 90) (length 0) (hide yes) "
				+ "(name \"~\") (number \"1\"))");

		Pin pin = parse(input);

		assertThat(pin.hide()).isEqualTo(Flag.named(true));
		assertThat(pin.name().effects()).isNull();
		assertThat(pin.toSexpr()).isEqualTo(input);
	}

	@Test
	void alternatesFollowTheNumber() {
		Sexpr input = SexprReader.read("(pin bidirectional line (at -7.62 0 0) (length 2.54) "
				+ "(name \"PA9\") (number \"30\") "
				+ "(alternate \"USART1_TX\" output line) (alternate \"TIM1_CH2\" bidirectional line))");

		Pin pin = parse(input);

		assertThat(pin.alternates()).containsExactly(
				new PinAlternate("USART1_TX", PinElectricalType.OUTPUT, PinGraphicStyle.LINE),
				new PinAlternate("TIM1_CH2", PinElectricalType.BIDIRECTIONAL, PinGraphicStyle.LINE));
		assertThat(pin.toSexpr()).isEqualTo(input);
	}

	@Test
	void bothNoConnectSpellingsAreAccepted() {
		assertThat(PinElectricalType.fromKeyword("no_connect")).isEqualTo(PinElectricalType.NO_CONNECT);
		assertThat(PinElectricalType.fromKeyword("unconnected")).isEqualTo(PinElectricalType.UNCONNECTED);
	}

	@Test
	void unknownElectricalType() {
		Sexpr input = SexprReader.read("(pin sideways line (at 0 0 0) (length 1) (name \"~\") (number \"1\"))");

		assertThatThrownBy(() -> parse(input))
				.isInstanceOfSatisfying(KiCadParseException.class, e -> {
					assertThat(e.error()).isEqualTo(new InvalidEnumValue("sideways", "pin electrical type"));
					assertThat(e.getMessage()).isEqualTo("Invalid value 'sideways' for pin electrical type");
				});
	}

	@Test
	void unknownGraphicStyle() {
		Sexpr input = SexprReader.read("(pin input wavy (at 0 0 0) (length 1) (name \"~\") (number \"1\"))");

		assertThatThrownBy(() -> parse(input))
				.isInstanceOfSatisfying(KiCadParseException.class,
						e -> assertThat(e.error()).isEqualTo(new InvalidEnumValue("wavy", "pin graphic style")));
	}

	@Test
	void errorInsideNameCarriesItsPath() {
		Sexpr input = SexprReader.read("(pin input line (at 0 0 0) (length 1) (name 5) (number \"1\"))");

		assertThatThrownBy(() -> parse(input))
				.isInstanceOfSatisfying(KiCadParseException.class,
						e -> assertThat(e.path()).containsExactly("name"));
	}
}
