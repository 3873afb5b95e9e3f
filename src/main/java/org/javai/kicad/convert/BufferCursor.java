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
import org.javai.kicad.sexpr.NodeView;
import org.javai.kicad.sexpr.SexprBuffer;
import org.javai.kicad.sexpr.SexprKind;
import org.javai.kicad.sexpr.TextView;

/**
 * Borrowing cursor over the children of one list in a {@link SexprBuffer}.
 * <p>
 * Same contract as {@link ListCursor}, but a cursor is just an index range into the
 * shared buffer: child cursors, {@link TextView}s and {@link NodeView}s all point back
 * into it and nothing is copied. Numbers come back as primitives. Matching a keyword
 * compares in place, so the hot path allocates only the cursors themselves.
 */
public final class BufferCursor {

	private final SexprBuffer buffer;
	private final int end;
	private int position;

	private BufferCursor(SexprBuffer buffer, int position, int end) {
		this.buffer = buffer;
		this.position = position;
		this.end = end;
	}

	/**
	 * A cursor over the children of the buffer's root list.
	 *
	 * @throws KiCadParseException if the root is not a list
	 */
	public static BufferCursor of(SexprBuffer buffer) {
		return listAt(buffer, 0);
	}

	private static BufferCursor listAt(SexprBuffer buffer, int index) {
		if (buffer.kind(index) != SexprKind.LIST) {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.LIST));
		}
		return new BufferCursor(buffer, index + 1, buffer.end(index));
	}

	public BufferCursor copy() {
		return new BufferCursor(buffer, position, end);
	}

	public boolean hasNext() {
		return position < end;
	}

	public Optional<NodeView> peek() {
		return hasNext() ? Optional.of(new NodeView(buffer, position)) : Optional.empty();
	}

	/**
	 * Kind of the next node, or {@code null} when exhausted.
	 */
	public SexprKind peekKind() {
		return hasNext() ? buffer.kind(position) : null;
	}

	/**
	 * Buffer index of the next node, or {@code -1} when exhausted. Allows structural peeks
	 * such as {@link SexprBuffer#listHeadIs(int, String)} without consuming.
	 */
	public int peekIndex() {
		return hasNext() ? position : -1;
	}

	/**
	 * Whether the next node is a list headed by {@code keyword}. Consumes nothing.
	 */
	public boolean nextIsListNamed(String keyword) {
		return hasNext() && buffer.listHeadIs(position, keyword);
	}

	public NodeView next() {
		return new NodeView(buffer, advance());
	}

	private int advance() {
		if (!hasNext()) {
			throw new KiCadParseException(new UnexpectedEndOfList());
		}
		int index = position;
		position = buffer.end(index);
		return index;
	}

	public BufferCursor expectList() {
		return listAt(buffer, advance());
	}

	public BufferCursor expectListWithName(String name) {
		BufferCursor list = expectList();
		list.expectSymbolMatching(name);
		return list;
	}

	public Optional<BufferCursor> maybeListWithName(String name) {
		if (nextIsListNamed(name)) {
			return Optional.of(expectListWithName(name));
		}
		return Optional.empty();
	}

	public TextView expectSymbol() {
		int index = advance();
		if (buffer.kind(index) != SexprKind.SYMBOL) {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.SYMBOL));
		}
		return buffer.text(index);
	}

	public void expectSymbolMatching(String expected) {
		int index = advance();
		if (buffer.kind(index) != SexprKind.SYMBOL) {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.SYMBOL));
		}
		if (!buffer.textEquals(index, expected)) {
			throw new KiCadParseException(new NonMatchingSymbol(buffer.text(index).toString(), expected));
		}
	}

	public boolean maybeSymbolMatching(String expected) {
		if (hasNext() && buffer.kind(position) == SexprKind.SYMBOL && buffer.textEquals(position, expected)) {
			position++;
			return true;
		}
		return false;
	}

	public TextView expectString() {
		int index = advance();
		if (buffer.kind(index) != SexprKind.STRING) {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.STRING));
		}
		return buffer.text(index);
	}

	public double expectNumber() {
		int index = advance();
		if (buffer.kind(index) != SexprKind.NUMBER) {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.NUMBER));
		}
		return buffer.number(index);
	}

	public OptionalDouble maybeNumber() {
		if (hasNext() && buffer.kind(position) == SexprKind.NUMBER) {
			return OptionalDouble.of(buffer.number(position++));
		}
		return OptionalDouble.empty();
	}

	public TextView expectStringWithName(String name) {
		BufferCursor list = expectListWithName(name);
		TextView value = list.expectString();
		list.expectEnd();
		return value;
	}

	public Optional<TextView> maybeStringWithName(String name) {
		return maybeListWithName(name).map(list -> {
			TextView value = list.expectString();
			list.expectEnd();
			return value;
		});
	}

	public TextView expectSymbolWithName(String name) {
		BufferCursor list = expectListWithName(name);
		TextView value = list.expectSymbol();
		list.expectEnd();
		return value;
	}

	public double expectNumberWithName(String name) {
		BufferCursor list = expectListWithName(name);
		double value = list.expectNumber();
		list.expectEnd();
		return value;
	}

	public OptionalDouble maybeNumberWithName(String name) {
		if (!nextIsListNamed(name)) {
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(expectNumberWithName(name));
	}

	/**
	 * Reads a named boolean in either vocabulary. See {@link ListCursor#expectNamedBool(String)}.
	 */
	public NamedBool expectNamedBool(String name) {
		BufferCursor list = expectListWithName(name);
		NamedBool value = list.expectBool();
		list.expectEnd();
		return value;
	}

	public Optional<NamedBool> maybeNamedBool(String name) {
		if (!nextIsListNamed(name)) {
			return Optional.empty();
		}
		return Optional.of(expectNamedBool(name));
	}

	public boolean expectBoolWithName(String name) {
		return expectNamedBool(name).value();
	}

	public Optional<Boolean> maybeBoolWithName(String name) {
		return maybeNamedBool(name).map(NamedBool::value);
	}

	/**
	 * Reads a flag in any of its spellings. See {@link ListCursor#maybeFlag(String)}.
	 */
	public Flag maybeFlag(String name) {
		if (maybeSymbolMatching(name)) {
			return Flag.keyword();
		}
		Optional<BufferCursor> list = maybeListWithName(name);
		if (list.isEmpty()) {
			return Flag.absent();
		}
		BufferCursor inner = list.get();
		if (!inner.hasNext()) {
			return Flag.emptyList();
		}
		NamedBool value = inner.expectBool();
		inner.expectEnd();
		return Flag.named(value);
	}

	private NamedBool expectBool() {
		int index = advance();
		if (buffer.kind(index) != SexprKind.SYMBOL) {
			throw new KiCadParseException(new UnexpectedSexprType(SexprKind.SYMBOL));
		}
		CharSequence text = buffer.text(index);
		BoolVocabulary vocabulary = BoolVocabulary.of(text);
		if (vocabulary == null) {
			throw new KiCadParseException(new InvalidEnumValue(text.toString(), "bool"));
		}
		return new NamedBool(vocabulary.word(true).contentEquals(text), vocabulary);
	}

	public void expectEnd() {
		if (hasNext()) {
			throw new KiCadParseException(new ExpectedEndOfList(buffer.toSexpr(position)));
		}
	}

	public <T> T expect(FromSexprRef<T> type) {
		int index = hasNext() ? position : -1;
		BufferCursor list = expectList();
		try {
			return type.parse(list);
		} catch (KiCadParseException e) {
			throw e.prependPath(entityName(index));
		}
	}

	public <T> Optional<T> maybe(SexprRefType<T> type) {
		if (hasNext() && buffer.kind(position) == SexprKind.LIST && type.isPresent(buffer, position)) {
			return Optional.of(expect(type));
		}
		return Optional.empty();
	}

	public <T> List<T> expectMany(SexprRefType<T> type) {
		List<T> result = new ArrayList<>();
		Optional<T> item;
		while ((item = maybe(type)).isPresent()) {
			result.add(item.get());
		}
		return result;
	}

	private String entityName(int index) {
		if (index >= 0 && index + 1 < buffer.end(index) && buffer.kind(index + 1) == SexprKind.SYMBOL) {
			return buffer.text(index + 1).toString();
		}
		return "list";
	}
}
