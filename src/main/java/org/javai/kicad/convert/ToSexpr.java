package org.javai.kicad.convert;

import org.javai.kicad.sexpr.Sexpr;

/**
 * Converts a typed entity back into its token tree, reproducing the spelling it was read from.
 */
public interface ToSexpr {

	Sexpr toSexpr();
}
