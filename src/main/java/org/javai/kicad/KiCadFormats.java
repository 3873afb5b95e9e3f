package org.javai.kicad;

import org.javai.kicad.config.KiCadFormatConfig;
import org.javai.kicad.config.KiCadFormatConfigLoader;
import org.javai.kicad.convert.KiCadParseError.UnexpectedSexprType;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprBuffer;
import org.javai.kicad.sexpr.SexprKind;
import org.javai.kicad.sexpr.SexprReader;
import org.javai.kicad.sexpr.SexprWriter;
import org.javai.kicad.symbol.SymbolLibraryFile;
import org.javai.kicad.symbol.fast.FastSymbolLibraryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for reading and writing KiCad documents.
 * <p>
 * Two parse paths produce identical models: {@link #parseSymbolLibrary(Sexpr)} walks an
 * owning token tree, {@link #parseSymbolLibraryFast(SexprBuffer)} reads a flattened buffer
 * without building one. Either way a document parses completely or not at all; failures
 * are reported as {@link KiCadParseException} with the path of the offending entity.
 */
public final class KiCadFormats {

	private static final Logger logger = LoggerFactory.getLogger(KiCadFormats.class);

	private static final String SYMBOL_LIBRARY = "kicad_symbol_lib";

	private KiCadFormats() {
	}

	public static SymbolLibraryFile parseSymbolLibrary(Sexpr root) {
		if (!(root instanceof Sexpr.ListNode list)) {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.LIST)).prependPath(SYMBOL_LIBRARY);
		}
		SymbolLibraryFile file;
		try {
			file = SymbolLibraryFile.fromSexpr(new ListCursor(list));
		} catch (KiCadParseException e) {
			throw e.prependPath(SYMBOL_LIBRARY);
		}
		logger.debug("Parsed symbol library version {} with {} symbols", file.version(), file.symbols().size());
		return file;
	}

	public static SymbolLibraryFile parseSymbolLibraryFast(SexprBuffer buffer) {
		SymbolLibraryFile file = FastSymbolLibraryParser.parse(buffer);
		logger.debug("Parsed symbol library version {} with {} symbols from {} nodes",
				file.version(), file.symbols().size(), buffer.size());
		return file;
	}

	public static Sexpr serialize(SymbolLibraryFile file) {
		return file.toSexpr();
	}

	/**
	 * @throws org.javai.kicad.sexpr.SexprSyntaxException if the text is not a single s-expression
	 * @throws KiCadParseException if it is not a symbol library
	 */
	public static SymbolLibraryFile readSymbolLibrary(String text) {
		return parseSymbolLibrary(SexprReader.read(text));
	}

	public static SymbolLibraryFile readSymbolLibraryFast(String text) {
		return parseSymbolLibraryFast(SexprReader.readBuffer(text));
	}

	/**
	 * Renders with the writer layout from the bundled configuration.
	 */
	public static String writeSymbolLibrary(SymbolLibraryFile file) {
		return writeSymbolLibrary(file, WriterHolder.WRITER);
	}

	public static String writeSymbolLibrary(SymbolLibraryFile file, SexprWriter writer) {
		return writer.write(serialize(file));
	}

	private static final class WriterHolder {
		static final SexprWriter WRITER = fromConfig(KiCadFormatConfigLoader.loadDefault());
	}

	static SexprWriter fromConfig(KiCadFormatConfig config) {
		KiCadFormatConfig.WriterOptions options = config.writer();
		return new SexprWriter(options.indent(), !options.compact());
	}
}
