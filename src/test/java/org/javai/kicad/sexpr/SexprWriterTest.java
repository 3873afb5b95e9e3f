package org.javai.kicad.sexpr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SexprWriterTest {

	@Test
	void compactWritesOneLine() {
		Sexpr tree = Sexpr.listWithName("property",
				Sexpr.string("Value"), Sexpr.string("R"),
				Sexpr.listWithName("at", Sexpr.number(0), Sexpr.number(-1.016), Sexpr.number(90)));

		assertThat(SexprWriter.compact().write(tree)).isEqualTo("(property \"Value\" \"R\" (at 0 -1.016 90))");
	}

	@Test
	void prettyBreaksBeforeNestedLists() {
		Sexpr tree = SexprReader.read("(symbol \"R\" (in_bom yes) (on_board yes))");

		String text = new SexprWriter("\t", true).write(tree);

		assertThat(text).isEqualTo("(symbol \"R\"\n\t(in_bom yes)\n\t(on_board yes)\n)\n");
	}

	@Test
	void prettyOutputReadsBackToSameTree() {
		Sexpr tree = SexprReader.read("(a b (c \"d\" (e 1.5 -2)) f (g))");

		assertThat(SexprReader.read(new SexprWriter().write(tree))).isEqualTo(tree);
	}

	@Test
	void formatNumber() {
		assertThat(SexprWriter.formatNumber(20211014)).isEqualTo("20211014");
		assertThat(SexprWriter.formatNumber(1.27)).isEqualTo("1.27");
		assertThat(SexprWriter.formatNumber(-3.81)).isEqualTo("-3.81");
		assertThat(SexprWriter.formatNumber(0.0001)).isEqualTo("0.0001");
		assertThat(SexprWriter.formatNumber(-0.0)).isEqualTo("-0");
		assertThatThrownBy(() -> SexprWriter.formatNumber(Double.NaN))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void quoteEscapesSpecialCharacters() {
		assertThat(SexprWriter.quote("a\"b\\c\nd")).isEqualTo("\"a\\\"b\\\\c\\nd\"");
	}
}
