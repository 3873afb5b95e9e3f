package org.javai.kicad.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import org.javai.kicad.convert.KiCadParseError.ExpectedEndOfList;
import org.javai.kicad.convert.KiCadParseError.InvalidEnumValue;
import org.javai.kicad.convert.KiCadParseError.NonMatchingSymbol;
import org.javai.kicad.convert.KiCadParseError.UnexpectedEndOfList;
import org.javai.kicad.convert.KiCadParseError.UnexpectedSexprType;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprKind;

/**
 * Owning cursor over the children of one list node.
 * <p>
 * The cursor only moves forward. To look ahead further than {@link #peek()}, read from a
 * {@link #copy()}; the copy advances independently of this cursor.
 */
public final class ListCursor {

	private final List<Sexpr> items;
	private int position;

	public ListCursor(Sexpr.ListNode list) {
		this(list.children(), 0);
	}

	private ListCursor(List<Sexpr> items, int position) {
		this.items = items;
		this.position = position;
	}

	/**
	 * An independent snapshot at the current position.
	 */
	public ListCursor copy() {
		return new ListCursor(items, position);
	}

	public boolean hasNext() {
		return position < items.size();
	}

	public Optional<Sexpr> peek() {
		return hasNext() ? Optional.of(items.get(position)) : Optional.empty();
	}

	/**
	 * Whether the next token is a list headed by {@code keyword}. Consumes nothing.
	 */
	public boolean nextIsListNamed(String keyword) {
		return peek().orElse(null) instanceof Sexpr.ListNode list && list.isNamed(keyword);
	}

	public Sexpr next() {
		if (!hasNext()) {
			throw new KiCadParseException(new UnexpectedEndOfList());
		}
		return items.get(position++);
	}

	public ListCursor expectList() {
		if (next() instanceof Sexpr.ListNode list) {
			return new ListCursor(list);
		}
		throw new KiCadParseException(new UnexpectedSexprType(SexprKind.LIST));
	}

	public ListCursor expectListWithName(String name) {
		ListCursor list = expectList();
		list.expectSymbolMatching(name);
		return list;
	}

	/**
	 * Consumes the next token only if it is a list headed by {@code name}.
	 */
	public Optional<ListCursor> maybeListWithName(String name) {
		if (nextIsListNamed(name)) {
			return Optional.of(expectListWithName(name));
		}
		return Optional.empty();
	}

	public String expectSymbol() {
		if (next() instanceof Sexpr.SymbolAtom symbol) {
			return symbol.value();
		}
		throw new KiCadParseException(new UnexpectedSexprType(SexprKind.SYMBOL));
	}

	public void expectSymbolMatching(String expected) {
		String symbol = expectSymbol();
		if (!symbol.equals(expected)) {
			throw new KiCadParseException(new NonMatchingSymbol(symbol, expected));
		}
	}

	/**
	 * Consumes the next token only if it is the symbol {@code expected}.
	 */
	public boolean maybeSymbolMatching(String expected) {
		if (peek().orElse(null) instanceof Sexpr.SymbolAtom symbol && symbol.value().equals(expected)) {
			position++;
			return true;
		}
		return false;
	}

	public String expectString() {
		if (next() instanceof Sexpr.StringAtom string) {
			return string.value();
		}
		throw new KiCadParseException(new UnexpectedSexprType(SexprKind.STRING));
	}

	public double expectNumber() {
		if (next() instanceof Sexpr.NumberAtom number) {
			return number.value();
		}
		throw new KiCadParseException(new UnexpectedSexprType(SexprKind.NUMBER));
	}

	public OptionalDouble maybeNumber() {
		if (peek().orElse(null) instanceof Sexpr.NumberAtom number) {
			position++;
			return OptionalDouble.of(number.value());
		}
		return OptionalDouble.empty();
	}

	/**
	 * Reads {@code (name "value")}.
	 */
	public String expectStringWithName(String name) {
		ListCursor list = expectListWithName(name);
		String value = list.expectString();
		list.expectEnd();
		return value;
	}

	public Optional<String> maybeStringWithName(String name) {
		return maybeListWithName(name).map(list -> {
			String value = list.expectString();
			list.expectEnd();
			return value;
		});
	}

	public String expectSymbolWithName(String name) {
		ListCursor list = expectListWithName(name);
		String value = list.expectSymbol();
		list.expectEnd();
		return value;
	}

	public double expectNumberWithName(String name) {
		ListCursor list = expectListWithName(name);
		double value = list.expectNumber();
		list.expectEnd();
		return value;
	}

	public OptionalDouble maybeNumberWithName(String name) {
		Optional<ListCursor> list = maybeListWithName(name);
		if (list.isEmpty()) {
			return OptionalDouble.empty();
		}
		double value = list.get().expectNumber();
		list.get().expectEnd();
		return OptionalDouble.of(value);
	}

	/**
	 * Reads {@code (name yes|no)} or {@code (name true|false)}, keeping which pair of
	 * words it was written with.
	 */
	public NamedBool expectNamedBool(String name) {
		ListCursor list = expectListWithName(name);
		NamedBool value = list.expectBool();
		list.expectEnd();
		return value;
	}

	public Optional<NamedBool> maybeNamedBool(String name) {
		return maybeListWithName(name).map(list -> {
			NamedBool value = list.expectBool();
			list.expectEnd();
			return value;
		});
	}

	public boolean expectBoolWithName(String name) {
		return expectNamedBool(name).value();
	}

	public Optional<Boolean> maybeBoolWithName(String name) {
		return maybeNamedBool(name).map(NamedBool::value);
	}

	/**
	 * Reads a flag in any of its spellings: the bare symbol {@code name}, the empty list
	 * {@code (name)}, or the named boolean {@code (name yes|no)} or {@code (name true|false)}.
	 * Consumes nothing and returns {@link Flag#absent()} when the next token is none of these.
	 */
	public Flag maybeFlag(String name) {
		if (maybeSymbolMatching(name)) {
			return Flag.keyword();
		}
		Optional<ListCursor> list = maybeListWithName(name);
		if (list.isEmpty()) {
			return Flag.absent();
		}
		ListCursor inner = list.get();
		if (!inner.hasNext()) {
			return Flag.emptyList();
		}
		NamedBool value = inner.expectBool();
		inner.expectEnd();
		return Flag.named(value);
	}

	private NamedBool expectBool() {
		String value = expectSymbol();
		BoolVocabulary vocabulary = BoolVocabulary.of(value);
		if (vocabulary == null) {
			throw new KiCadParseException(new InvalidEnumValue(value, "bool"));
		}
		return new NamedBool(vocabulary.word(true).equals(value), vocabulary);
	}

	public void expectEnd() {
		if (hasNext()) {
			throw new KiCadParseException(new ExpectedEndOfList(items.get(position)));
		}
	}

	/**
	 * Parses the next token, which must be a list, as {@code type}.
	 */
	public <T> T expect(FromSexpr<T> type) {
		Sexpr node = peek().orElse(null);
		ListCursor list = expectList();
		try {
			return type.parse(list);
		} catch (KiCadParseException e) {
			throw e.prependPath(entityName(node));
		}
	}

	/**
	 * Parses the next token as {@code type} if its presence test accepts it; otherwise
	 * consumes nothing.
	 */
	public <T> Optional<T> maybe(SexprType<T> type) {
		if (peek().orElse(null) instanceof Sexpr.ListNode list && type.isPresent(list)) {
			return Optional.of(expect(type));
		}
		return Optional.empty();
	}

	/**
	 * Parses consecutive tokens as {@code type} until the presence test rejects one.
	 */
	public <T> List<T> expectMany(SexprType<T> type) {
		List<T> result = new ArrayList<>();
		Optional<T> item;
		while ((item = maybe(type)).isPresent()) {
			result.add(item.get());
		}
		return result;
	}

	private static String entityName(Sexpr node) {
		if (node instanceof Sexpr.ListNode list) {
			return list.firstSymbol().orElse("list");
		}
		return "list";
	}
}
