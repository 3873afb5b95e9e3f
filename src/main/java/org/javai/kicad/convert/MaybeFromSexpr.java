package org.javai.kicad.convert;

import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprBuffer;

/**
 * Cheap structural test deciding whether a list node belongs to an entity type, without
 * parsing it. Optional and repeated fields are driven by this test; a node that passes
 * it and then fails to parse is a hard error.
 */
public interface MaybeFromSexpr {

	boolean isPresent(Sexpr.ListNode list);

	boolean isPresent(SexprBuffer buffer, int listIndex);
}
