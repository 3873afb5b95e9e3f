package org.javai.kicad.symbol;

import java.util.List;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.Numbers;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * A {@code .kicad_sym} file.
 * <pre>
 * (kicad_symbol_lib (version 20231120) (generator "kicad_symbol_editor") (generator_version "8.0")?
 *   symbol*)
 * </pre>
 *
 * @param version format version as a {@code YYYYMMDD} date
 * @param generatorVersion {@code null} in files written before KiCad 8
 */
public record SymbolLibraryFile(int version, Generator generator, String generatorVersion, List<SymbolDefinition> symbols)
		implements ToSexpr {

	public SymbolLibraryFile {
		if (generator == null) {
			throw new IllegalArgumentException("generator must not be null");
		}
		symbols = symbols != null ? List.copyOf(symbols) : List.of();
	}

	public static SymbolLibraryFile fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("kicad_symbol_lib");
		int version = Numbers.toInt(cursor.expectNumberWithName("version"), "version");
		Generator generator = cursor.expect(Generator::fromSexpr);
		String generatorVersion = cursor.maybeStringWithName("generator_version").orElse(null);
		List<SymbolDefinition> symbols = cursor.expectMany(SymbolDefinition.TYPE);
		cursor.expectEnd();
		return new SymbolLibraryFile(version, generator, generatorVersion, symbols);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("kicad_symbol_lib")
				.add(Sexpr.numberWithName("version", version))
				.add(generator)
				.optionalString("generator_version", generatorVersion)
				.addAll(symbols)
				.build();
	}
}
