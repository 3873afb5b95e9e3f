package org.javai.kicad.symbol;

import org.javai.kicad.common.TextEffects;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.sexpr.Sexpr;

/**
 * The {@code (name "text" (effects ...))} or {@code (number "text" (effects ...))} of a pin.
 */
public record PinText(String text, TextEffects effects) {

	public PinText {
		if (text == null) {
			throw new IllegalArgumentException("text must not be null");
		}
	}

	static PinText fromSexpr(ListCursor cursor, String keyword) {
		cursor.expectSymbolMatching(keyword);
		String text = cursor.expectString();
		TextEffects effects = cursor.maybe(TextEffects.TYPE).orElse(null);
		cursor.expectEnd();
		return new PinText(text, effects);
	}

	Sexpr toSexpr(String keyword) {
		return SexprBuilder.list(keyword)
				.add(Sexpr.string(text))
				.add(effects)
				.build();
	}
}
