package org.javai.kicad.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link KiCadFormatConfig} from YAML.
 * <p>
 * Missing sections fall back to their defaults; a section of the wrong shape is an error.
 */
public class KiCadFormatConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(KiCadFormatConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/kicad-format.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load the configuration bundled with the library.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if parsing fails
	 */
	public static KiCadFormatConfig loadDefault() {
		return new KiCadFormatConfigLoader().loadResource(DEFAULT_RESOURCE, KiCadFormatConfigLoader.class.getClassLoader());
	}

	/**
	 * Load a configuration from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if parsing fails
	 */
	public KiCadFormatConfig loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			KiCadFormatConfig config = parse(is);
			logger.debug("Loaded configuration from {} ({} interned keys)", resourcePath, config.internedKeys().size());
			return config;
		} catch (IllegalArgumentException | IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load configuration from resource: " + resourcePath, e);
		}
	}

	public KiCadFormatConfig parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load configuration from path: " + path, e);
		}
	}

	public KiCadFormatConfig parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse configuration from input stream", e);
		}
	}

	public KiCadFormatConfig parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse configuration from reader", e);
		}
	}

	public KiCadFormatConfig parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse configuration from string", e);
		}
	}

	private KiCadFormatConfig build(Object loaded) {
		if (loaded == null) {
			logger.warn("Empty configuration; using defaults");
			return new KiCadFormatConfig(1, List.of(), null);
		}
		Map<String, Object> data = asMap(loaded, "root");

		Object versionObj = data.get("config_version");
		int configVersion = versionObj instanceof Number n ? n.intValue() : 1;

		List<String> internedKeys = asStringList(data.get("interned_keys"), "interned_keys");
		KiCadFormatConfig.WriterOptions writer = buildWriter(data.get("writer"));

		return new KiCadFormatConfig(configVersion, internedKeys, writer);
	}

	private KiCadFormatConfig.WriterOptions buildWriter(Object writerObj) {
		if (writerObj == null) {
			return KiCadFormatConfig.WriterOptions.DEFAULT;
		}
		Map<String, Object> writerMap = asMap(writerObj, "writer");
		Object indent = writerMap.get("indent");
		Object compact = writerMap.get("compact");
		return new KiCadFormatConfig.WriterOptions(
			indent != null ? String.valueOf(indent) : null,
			compact instanceof Boolean b && b
		);
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String section) {
		if (!(value instanceof Map)) {
			throw new IllegalStateException("Section '" + section + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static List<String> asStringList(Object value, String section) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new IllegalStateException("Section '" + section + "' must be a list");
		}
		return list.stream().map(String::valueOf).toList();
	}
}
