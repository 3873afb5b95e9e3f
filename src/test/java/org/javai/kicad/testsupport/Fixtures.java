package org.javai.kicad.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads the sample libraries under {@code src/test/resources/symbol_library}.
 */
public final class Fixtures {

	public static final String LEGACY = "legacy_kicad6.kicad_sym";
	public static final String CURRENT = "current_kicad8.kicad_sym";
	public static final String MULTI_UNIT = "multi_unit.kicad_sym";

	public static final List<String> ALL = List.of(LEGACY, CURRENT, MULTI_UNIT);

	private Fixtures() {
	}

	public static String read(String name) {
		String path = "symbol_library/" + name;
		try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(path)) {
			if (in == null) {
				throw new IllegalArgumentException("Fixture not found: " + path);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
