package org.javai.kicad.config;

import java.util.List;

/**
 * Library configuration, read from {@code META-INF/kicad-format.yml}.
 *
 * @param configVersion version of the configuration layout
 * @param internedKeys property keys shared by the intern table
 * @param writer layout of rendered text
 */
public record KiCadFormatConfig(int configVersion, List<String> internedKeys, WriterOptions writer) {

	public KiCadFormatConfig {
		internedKeys = internedKeys != null ? List.copyOf(internedKeys) : List.of();
		writer = writer != null ? writer : WriterOptions.DEFAULT;
	}

	/**
	 * @param indent text repeated once per nesting level
	 * @param compact write every document on a single line
	 */
	public record WriterOptions(String indent, boolean compact) {

		public static final WriterOptions DEFAULT = new WriterOptions("  ", false);

		public WriterOptions {
			indent = indent != null ? indent : "  ";
		}
	}
}
