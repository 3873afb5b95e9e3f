package org.javai.kicad.intern;

import org.javai.kicad.config.KiCadFormatConfig;
import org.javai.kicad.config.KiCadFormatConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide interning of symbol property keys.
 * <p>
 * Keys on the configured allow-list ({@code Value}, {@code Reference}, {@code Footprint}
 * and friends) resolve to one shared {@code String} instance, so a library with thousands
 * of symbols holds each of them once. Any other key comes back as a fresh string equal
 * to the input; interning never fails.
 * <p>
 * The table is built from the bundled configuration the first time it is needed. JVM
 * class initialisation guarantees this happens exactly once even under contention, and
 * the table is read-only afterwards.
 */
public final class PropertyKeyInterner {

	private static final Logger logger = LoggerFactory.getLogger(PropertyKeyInterner.class);

	private PropertyKeyInterner() {
	}

	private static final class Holder {
		static final InternTable TABLE = load();
	}

	private static InternTable load() {
		KiCadFormatConfig config = KiCadFormatConfigLoader.loadDefault();
		InternTable table = InternTable.of(config.internedKeys());
		logger.debug("Initialised property key intern table with {} keys", table.size());
		return table;
	}

	/**
	 * Returns the shared instance for an allow-listed key, otherwise a new string with the
	 * same content; a {@code String} argument is copied too, never handed back. Looking up
	 * a listed key allocates nothing.
	 */
	public static String intern(CharSequence key) {
		String canonical = Holder.TABLE.find(key);
		if (canonical != null) {
			return canonical;
		}
		return key instanceof String text ? new String(text) : key.toString();
	}

	/**
	 * Whether {@code key} is on the allow-list.
	 */
	public static boolean isInterned(CharSequence key) {
		return Holder.TABLE.find(key) != null;
	}
}
