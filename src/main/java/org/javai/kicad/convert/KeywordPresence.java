package org.javai.kicad.convert;

import java.util.Set;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprBuffer;

/**
 * Presence test for entities whose list starts with one of a fixed set of keywords.
 */
public record KeywordPresence(Set<String> keywords) implements MaybeFromSexpr {

	public KeywordPresence {
		if (keywords == null || keywords.isEmpty()) {
			throw new IllegalArgumentException("keywords must not be empty");
		}
		keywords = Set.copyOf(keywords);
	}

	public static KeywordPresence of(String keyword) {
		return new KeywordPresence(Set.of(keyword));
	}

	@Override
	public boolean isPresent(Sexpr.ListNode list) {
		return list.firstSymbol().map(keywords::contains).orElse(false);
	}

	@Override
	public boolean isPresent(SexprBuffer buffer, int listIndex) {
		for (String keyword : keywords) {
			if (buffer.listHeadIs(listIndex, keyword)) {
				return true;
			}
		}
		return false;
	}
}
