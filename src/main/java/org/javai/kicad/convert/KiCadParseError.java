package org.javai.kicad.convert;

import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprKind;

/**
 * Why a node failed to convert. Sealed so callers can handle every case.
 */
public sealed interface KiCadParseError {

	/**
	 * Human readable description of the failure.
	 */
	String message();

	/**
	 * A token was required but the list had no more children.
	 */
	record UnexpectedEndOfList() implements KiCadParseError {
		@Override
		public String message() {
			return "Unexpected end of list";
		}
	}

	/**
	 * The next token was not of the required kind.
	 */
	record UnexpectedSexprType(SexprKind expected) implements KiCadParseError {
		@Override
		public String message() {
			return "Expected a " + expected.label();
		}
	}

	/**
	 * A symbol was present but had the wrong value.
	 */
	record NonMatchingSymbol(String found, String expected) implements KiCadParseError {
		@Override
		public String message() {
			return "Expected symbol '" + expected + "' but found '" + found + "'";
		}
	}

	/**
	 * A symbol is not part of the vocabulary of an enumerated field.
	 */
	record InvalidEnumValue(String value, String enumName) implements KiCadParseError {
		@Override
		public String message() {
			return "Invalid value '" + value + "' for " + enumName;
		}
	}

	/**
	 * A number in a whole-number field had a fraction or did not fit an {@code int}.
	 */
	record InvalidInteger(double value, String field) implements KiCadParseError {
		@Override
		public String message() {
			return "Invalid integer " + value + " for " + field;
		}
	}

	/**
	 * A list had more children than its grammar allows.
	 *
	 * @param found the first unexpected child
	 */
	record ExpectedEndOfList(Sexpr found) implements KiCadParseError {
		@Override
		public String message() {
			return "Expected end of list but found " + found;
		}
	}

	/**
	 * A {@code library:name} identifier failed its structural check.
	 */
	record LibraryIdMalformed(String input, String reason) implements KiCadParseError {
		@Override
		public String message() {
			return "Malformed library identifier '" + input + "': " + reason;
		}
	}

	/**
	 * A sub-unit name is not of the form {@code Parent_unit_style}.
	 */
	record UnitIdMalformed(String input) implements KiCadParseError {
		@Override
		public String message() {
			return "Malformed unit identifier '" + input + "'";
		}
	}
}
