package org.javai.kicad.convert;

/**
 * Parses an entity from an owning cursor positioned at the entity's keyword.
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface FromSexpr<T> {

	/**
	 * @throws KiCadParseException if the children do not match the entity's grammar
	 */
	T parse(ListCursor cursor);
}
