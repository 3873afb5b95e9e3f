package org.javai.kicad.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.kicad.KiCadFormats;
import org.javai.kicad.symbol.SymbolLibraryFile;
import org.javai.kicad.testsupport.Fixtures;
import org.junit.jupiter.api.Test;

class KiCadJsonTest {

	private static final String MINIMAL =
			"(kicad_symbol_lib (version 20211014) (generator kicad_symbol_editor) "
					+ "(symbol \"Device:R\" (in_bom yes) (on_board yes)) "
					+ "(symbol \"Device:R_Small\" (extends \"R\")))";

	private static final String BOM_AND_BOARD = "\"inBom\":{\"value\":true,\"vocabulary\":\"YES_NO\"},"
			+ "\"onBoard\":{\"value\":true,\"vocabulary\":\"YES_NO\"}";

	private final ObjectMapper mapper = new ObjectMapper();

	@Test
	void fixturesSurviveJson() throws JsonProcessingException {
		for (String fixture : Fixtures.ALL) {
			SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(Fixtures.read(fixture));

			assertThat(KiCadJson.fromJson(KiCadJson.toJson(file))).as(fixture).isEqualTo(file);
		}
	}

	@Test
	void variantsCarryATypeDiscriminator() throws JsonProcessingException {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(MINIMAL);

		JsonNode json = mapper.readTree(KiCadJson.toJson(file));

		assertThat(json.get("version").asInt()).isEqualTo(20211014);
		assertThat(json.get("generator").get("type").asText()).isEqualTo("symbol");
		assertThat(json.get("generator").get("name").asText()).isEqualTo("kicad_symbol_editor");
		assertThat(json.get("generator").has("string")).isFalse();
		assertThat(json.get("symbols").get(0).get("type").asText()).isEqualTo("root_symbol");
		assertThat(json.get("symbols").get(0).get("id").asText()).isEqualTo("Device:R");
		assertThat(json.get("symbols").get(1).get("type").asText()).isEqualTo("derived_symbol");
		assertThat(json.get("symbols").get(1).get("parent").asText()).isEqualTo("R");
		assertThat(json.get("symbols").get(0).get("inBom").get("vocabulary").asText()).isEqualTo("YES_NO");
	}

	@Test
	void trueFalseVocabularySurvivesJson() throws JsonProcessingException {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(
				"(kicad_symbol_lib (version 20211014) (generator kicad_symbol_editor) "
						+ "(symbol \"Device:R\" (in_bom true) (on_board false)))");

		SymbolLibraryFile copy = KiCadJson.fromJson(KiCadJson.toJson(file));

		assertThat(KiCadFormats.writeSymbolLibrary(copy)).contains("(in_bom true)").contains("(on_board false)");
	}

	@Test
	void graphicItemsAreWrittenAsText() throws JsonProcessingException {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(Fixtures.read(Fixtures.LEGACY));

		JsonNode json = mapper.readTree(KiCadJson.toJson(file));
		JsonNode rectangle = json.get("symbols").get(0).get("units").get(0).get("graphicItems").get(0);

		assertThat(rectangle.get("node").asText()).startsWith("(rectangle (start -1.016 -2.54) (end 1.016 2.54)");
	}

	@Test
	void enumsUseTheirKeywords() throws JsonProcessingException {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(Fixtures.read(Fixtures.LEGACY));

		JsonNode pin = mapper.readTree(KiCadJson.toJson(file))
				.get("symbols").get(2).get("units").get(1).get("pins").get(0);

		assertThat(pin.get("electricalType").asText()).isEqualTo("power_in");
		assertThat(pin.get("graphicStyle").asText()).isEqualTo("line");
		assertThat(pin.get("hide").get("spelling").asText()).isEqualTo("KEYWORD");
	}

	@Test
	void prettyAndCompactDescribeTheSameLibrary() throws JsonProcessingException {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(MINIMAL);

		String pretty = KiCadJson.toPrettyJson(file);

		assertThat(pretty).contains("\n");
		assertThat(mapper.readTree(pretty)).isEqualTo(mapper.readTree(KiCadJson.toJson(file)));
	}

	@Test
	void malformedGraphicNodeIsRejected() {
		String json = "{\"version\":1,\"generator\":{\"type\":\"string\",\"name\":\"x\"},\"symbols\":[{"
				+ "\"type\":\"root_symbol\",\"id\":\"R\"," + BOM_AND_BOARD + ","
				+ "\"graphicItems\":[{\"node\":\"(rectangle (start 0 0)\"}]}]}";

		assertThatThrownBy(() -> KiCadJson.fromJson(json)).isInstanceOf(JsonProcessingException.class);
	}

	@Test
	void malformedLibraryIdIsRejected() {
		String json = "{\"version\":1,\"generator\":{\"type\":\"string\",\"name\":\"x\"},\"symbols\":[{"
				+ "\"type\":\"root_symbol\",\"id\":\"a:b:c\"," + BOM_AND_BOARD + "}]}";

		assertThatThrownBy(() -> KiCadJson.fromJson(json)).isInstanceOf(JsonProcessingException.class);
	}

	@Test
	void mapperCanBeReused() throws JsonProcessingException {
		SymbolLibraryFile file = KiCadFormats.readSymbolLibrary(MINIMAL);
		ObjectMapper custom = KiCadJson.newMapper();

		String json = custom.writeValueAsString(file);

		assertThat(custom.readValue(json, SymbolLibraryFile.class)).isEqualTo(file);
	}
}
