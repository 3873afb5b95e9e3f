package org.javai.kicad.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.symbol.SymbolLibraryFile;

/**
 * JSON view of the typed model.
 * <p>
 * Sealed variants carry a {@code type} discriminator, identifiers are written as their
 * text and opaque graphic nodes as compact s-expression text, so
 * {@code fromJson(toJson(file))} equals {@code file}.
 */
public final class KiCadJson {

	private static final ObjectMapper DEFAULT_MAPPER = newMapper();

	private KiCadJson() {
	}

	/**
	 * A mapper configured for the model types.
	 */
	public static ObjectMapper newMapper() {
		return new ObjectMapper().registerModule(module());
	}

	/**
	 * The serializers for model types Jackson cannot handle on its own.
	 */
	public static SimpleModule module() {
		SimpleModule module = new SimpleModule("kicad-format");
		module.addSerializer(Sexpr.ListNode.class, new ListNodeSerializer());
		module.addDeserializer(Sexpr.ListNode.class, new ListNodeDeserializer());
		return module;
	}

	public static String toJson(SymbolLibraryFile file) throws JsonProcessingException {
		return DEFAULT_MAPPER.writeValueAsString(file);
	}

	public static String toPrettyJson(SymbolLibraryFile file) throws JsonProcessingException {
		return DEFAULT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(file);
	}

	/**
	 * @throws JsonProcessingException if the JSON does not describe a symbol library
	 */
	public static SymbolLibraryFile fromJson(String json) throws JsonProcessingException {
		return DEFAULT_MAPPER.readValue(json, SymbolLibraryFile.class);
	}
}
