package org.javai.kicad.convert;

import java.util.Set;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprBuffer;

/**
 * An entity type on the borrowing path: a parser paired with its presence test.
 *
 * @param <T> the entity type
 */
public interface SexprRefType<T> extends FromSexprRef<T>, MaybeFromSexpr {

	String name();

	static <T> SexprRefType<T> keyword(String keyword, FromSexprRef<T> parser) {
		return new Keyed<>(keyword, KeywordPresence.of(keyword), parser);
	}

	static <T> SexprRefType<T> keywords(String name, Set<String> keywords, FromSexprRef<T> parser) {
		return new Keyed<>(name, new KeywordPresence(keywords), parser);
	}

	record Keyed<T>(String name, KeywordPresence presence, FromSexprRef<T> parser) implements SexprRefType<T> {

		@Override
		public T parse(BufferCursor cursor) {
			return parser.parse(cursor);
		}

		@Override
		public boolean isPresent(Sexpr.ListNode list) {
			return presence.isPresent(list);
		}

		@Override
		public boolean isPresent(SexprBuffer buffer, int listIndex) {
			return presence.isPresent(buffer, listIndex);
		}
	}
}
