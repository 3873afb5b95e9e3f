package org.javai.kicad.symbol;

import org.javai.kicad.common.Position;
import org.javai.kicad.common.TextEffects;
import org.javai.kicad.convert.Flag;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.Numbers;
import org.javai.kicad.convert.SexprBuilder;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.intern.PropertyKeyInterner;
import org.javai.kicad.sexpr.Sexpr;

/**
 * A key/value field of a symbol.
 * <pre>
 * (property "Reference" "R" (id 0)? (at 2.032 0 90) (hide yes)? (show_name)? (do_not_autoplace)?
 *   (effects ...)?)
 * </pre>
 * The key is interned. {@code (id n)} only appears in KiCad 6 files; the number is kept
 * exactly as read and carries no further meaning here.
 */
public record SymbolProperty(
		String key,
		String value,
		Double legacyId,
		Position position,
		Flag hide,
		Flag showName,
		Flag doNotAutoplace,
		TextEffects effects
) implements ToSexpr {

	public static final SexprType<SymbolProperty> TYPE = SexprType.keyword("property", SymbolProperty::fromSexpr);

	public SymbolProperty {
		if (key == null || value == null || position == null) {
			throw new IllegalArgumentException("key, value and position are required");
		}
		hide = hide != null ? hide : Flag.absent();
		showName = showName != null ? showName : Flag.absent();
		doNotAutoplace = doNotAutoplace != null ? doNotAutoplace : Flag.absent();
	}

	public static SymbolProperty fromSexpr(ListCursor cursor) {
		cursor.expectSymbolMatching("property");
		String key = PropertyKeyInterner.intern(cursor.expectString());
		String value = cursor.expectString();
		Double legacyId = Numbers.orNull(cursor.maybeNumberWithName("id"));
		Position position = cursor.expect(Position::fromSexpr);
		Flag hide = cursor.maybeFlag("hide");
		Flag showName = cursor.maybeFlag("show_name");
		Flag doNotAutoplace = cursor.maybeFlag("do_not_autoplace");
		TextEffects effects = cursor.maybe(TextEffects.TYPE).orElse(null);
		cursor.expectEnd();
		return new SymbolProperty(key, value, legacyId, position, hide, showName, doNotAutoplace, effects);
	}

	@Override
	public Sexpr toSexpr() {
		return SexprBuilder.list("property")
				.add(Sexpr.string(key))
				.add(Sexpr.string(value))
				.optionalNumber("id", legacyId)
				.add(position)
				.flag("hide", hide)
				.flag("show_name", showName)
				.flag("do_not_autoplace", doNotAutoplace)
				.add(effects)
				.build();
	}
}
