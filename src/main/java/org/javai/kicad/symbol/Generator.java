package org.javai.kicad.symbol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.javai.kicad.convert.KiCadParseError.UnexpectedEndOfList;
import org.javai.kicad.convert.KiCadParseError.UnexpectedSexprType;
import org.javai.kicad.convert.KiCadParseException;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprKind;

/**
 * The program that wrote a library. Older files spell it as a bare symbol
 * ({@code (generator kicad_symbol_editor)}), newer ones as a string.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
		@JsonSubTypes.Type(value = Generator.Bare.class, name = "symbol"),
		@JsonSubTypes.Type(value = Generator.Quoted.class, name = "string")
})
public sealed interface Generator extends ToSexpr {

	String name();

	/**
	 * Whether the source spelled the name as a string.
	 */
	@JsonIgnore
	default boolean isString() {
		return this instanceof Quoted;
	}

	record Bare(@JsonProperty("name") String name) implements Generator {
		@Override
		public Sexpr toSexpr() {
			return Sexpr.symbolWithName("generator", name);
		}
	}

	record Quoted(@JsonProperty("name") String name) implements Generator {
		@Override
		public Sexpr toSexpr() {
			return Sexpr.stringWithName("generator", name);
		}
	}

	static Generator fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("generator");
		Sexpr next = cursor.peek().orElseThrow(() -> new KiCadParseException(new UnexpectedEndOfList()));
		Generator generator;
		if (next instanceof Sexpr.StringAtom) {
			generator = new Quoted(cursor.expectString());
		} else if (next instanceof Sexpr.SymbolAtom) {
			generator = new Bare(cursor.expectSymbol());
		} else {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.STRING));
		}
		cursor.expectEnd();
		return generator;
	}
}
