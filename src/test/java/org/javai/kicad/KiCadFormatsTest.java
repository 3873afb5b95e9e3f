package org.javai.kicad;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.kicad.config.KiCadFormatConfig;
import org.javai.kicad.sexpr.SexprSyntaxException;
import org.javai.kicad.sexpr.SexprWriter;
import org.javai.kicad.symbol.SymbolLibraryFile;
import org.javai.kicad.testsupport.Fixtures;
import org.javai.kicad.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class KiCadFormatsTest {

	private static final String MINIMAL =
			"(kicad_symbol_lib (version 20211014) (generator kicad_symbol_editor) "
					+ "(symbol \"Device:R\" (in_bom yes) (on_board yes)))";

	@Test
	void writesWithTheBundledLayout() {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(MINIMAL);

		assertThat(KiCadFormats.writeSymbolLibrary(file)).isEqualTo(
				"(kicad_symbol_lib\n"
						+ "  (version 20211014)\n"
						+ "  (generator kicad_symbol_editor)\n"
						+ "  (symbol \"Device:R\"\n"
						+ "    (in_bom yes)\n"
						+ "    (on_board yes)\n"
						+ "  )\n"
						+ ")\n");
	}

	@Test
	void writesWithAGivenWriter() {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(MINIMAL);

		assertThat(KiCadFormats.writeSymbolLibrary(file, SexprWriter.compact())).isEqualTo(MINIMAL);
	}

	@Test
	void compactConfigurationDisablesLineBreaks() {
		KiCadFormatConfig config = new KiCadFormatConfig(1, List.of(),
				new KiCadFormatConfig.WriterOptions("\t", true));

		SexprWriter writer = KiCadFormats.fromConfig(config);

		assertThat(writer.write(KiCadFormats.serialize(KiCadFormats.readSymbolLibrary(MINIMAL)))).isEqualTo(MINIMAL);
	}

	@Test
	void tabIndentedConfiguration() {
		KiCadFormatConfig config = new KiCadFormatConfig(1, List.of(),
				new KiCadFormatConfig.WriterOptions("\t", false));

		String text = KiCadFormats.writeSymbolLibrary(KiCadFormats.readSymbolLibrary(MINIMAL),
				KiCadFormats.fromConfig(config));

		assertThat(text).contains("\n\t(version 20211014)\n").contains("\n\t\t(in_bom yes)\n");
	}

	@Test
	void writtenTextReadsBackToTheSameModel() {
		for (String fixture : Fixtures.ALL) {
			SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(Fixtures.read(fixture));

			String written = KiCadFormats.writeSymbolLibrary(file);

			assertThat(KiCadFormats.readSymbolLibrary(written)).as(fixture).isEqualTo(file);
			assertThat(KiCadFormats.readSymbolLibraryFast(written)).as(fixture).isEqualTo(file);
		}
	}

	@Test
	void syntaxErrorsAreNotParseErrors() {
		assertThatThrownBy(() -> KiCadFormats.readSymbolLibrary("(kicad_symbol_lib (version 1)"))
				.isInstanceOf(SexprSyntaxException.class);
		assertThatThrownBy(() -> KiCadFormats.readSymbolLibraryFast("(kicad_symbol_lib \"open"))
				.isInstanceOf(SexprSyntaxException.class);
	}

	@Test
	void parsesAreLoggedAtDebug() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(KiCadFormats.class, Level.DEBUG)) {
			KiCadFormats.readSymbolLibrary(MINIMAL);
			KiCadFormats.readSymbolLibraryFast(MINIMAL);

			assertThat(captor.messagesAt(Level.DEBUG)).containsExactly(
					"Parsed symbol library version 20211014 with 1 symbols",
					"Parsed symbol library version 20211014 with 1 symbols from 17 nodes");
		}
	}
}
