package org.javai.kicad.symbol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Optional;
import org.javai.kicad.common.LibraryId;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;

/**
 * A top-level {@code symbol} of a library: either a {@link RootSymbol} with its own body
 * or a {@link DerivedSymbol} that names the root it extends.
 * <p>
 * Both start with {@code (symbol "id" ...)}; a derived symbol is recognised by an
 * {@code (extends ...)} list directly after the id.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
		@JsonSubTypes.Type(value = RootSymbol.class, name = "root_symbol"),
		@JsonSubTypes.Type(value = DerivedSymbol.class, name = "derived_symbol")
})
public sealed interface SymbolDefinition extends ToSexpr permits RootSymbol, DerivedSymbol {

	SexprType<SymbolDefinition> TYPE = SexprType.keyword("symbol", SymbolDefinition::fromSexpr);

	LibraryId id();

	List<SymbolProperty> properties();

	/**
	 * Snapshots the cursor, then reads keyword and id from the live cursor. With
	 * {@code (extends ...)} next, the live cursor goes on as a derived symbol; without it
	 * the snapshot is parsed from its start as a root symbol.
	 */
	static SymbolDefinition fromSexpr(ListCursor cursor) {
		ListCursor snapshot = cursor.copy();
		Optional<DerivedSymbol> derived = DerivedSymbol.readIfDerived(cursor);
		if (derived.isPresent()) {
			return derived.get();
		}
		return RootSymbol.fromSexpr(snapshot);
	}
}
