package org.javai.kicad.convert;

import java.util.Set;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprBuffer;

/**
 * An entity type on the owning path: a parser paired with its presence test.
 *
 * @param <T> the entity type
 */
public interface SexprType<T> extends FromSexpr<T>, MaybeFromSexpr {

	/**
	 * Entity name used in error paths.
	 */
	String name();

	/**
	 * A type whose list is headed by {@code keyword}.
	 */
	static <T> SexprType<T> keyword(String keyword, FromSexpr<T> parser) {
		return new Keyed<>(keyword, KeywordPresence.of(keyword), parser);
	}

	/**
	 * A type whose list is headed by any of {@code keywords}.
	 */
	static <T> SexprType<T> keywords(String name, Set<String> keywords, FromSexpr<T> parser) {
		return new Keyed<>(name, new KeywordPresence(keywords), parser);
	}

	record Keyed<T>(String name, KeywordPresence presence, FromSexpr<T> parser) implements SexprType<T> {

		@Override
		public T parse(ListCursor cursor) {
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
