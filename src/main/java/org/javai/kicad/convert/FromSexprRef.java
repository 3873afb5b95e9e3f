package org.javai.kicad.convert;

/**
 * Parses an entity from a borrowing cursor positioned at the entity's keyword.
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface FromSexprRef<T> {

	/**
	 * @throws KiCadParseException if the children do not match the entity's grammar
	 */
	T parse(BufferCursor cursor);
}
