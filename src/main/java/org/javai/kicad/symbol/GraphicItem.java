package org.javai.kicad.symbol;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.javai.kicad.convert.ListCursor;
import org.javai.kicad.convert.SexprType;
import org.javai.kicad.convert.ToSexpr;
import org.javai.kicad.sexpr.Sexpr;

/**
 * A drawing primitive of a symbol body, kept as the node it was read from.
 */
public record GraphicItem(@JsonProperty("node") Sexpr.ListNode node) implements ToSexpr {

	public static final Set<String> KINDS = Set.of("arc", "bezier", "circle", "polyline", "rectangle", "text", "text_box");

	public static final SexprType<GraphicItem> TYPE = SexprType.keywords("graphic item", KINDS, GraphicItem::fromSexpr);

	public GraphicItem {
		if (node == null || node.firstSymbol().filter(KINDS::contains).isEmpty()) {
			throw new IllegalArgumentException("not a graphic item: " + node);
		}
	}

	/**
	 * The primitive's keyword, such as {@code rectangle}.
	 */
	public String kind() {
		return node.firstSymbol().orElseThrow();
	}

	public static GraphicItem fromSexpr(ListCursor cursor) {
		List<Sexpr> children = new ArrayList<>();
		while (cursor.hasNext()) {
			children.add(cursor.next());
		}
		return new GraphicItem(Sexpr.list(children));
	}

	@Override
	public Sexpr toSexpr() {
		return node;
	}
}
