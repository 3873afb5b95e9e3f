package org.javai.kicad.intern;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class InternTableTest {

	@Test
	void findsEveryKeyAndNothingElse() {
		List<String> keys = List.of("Value", "Reference", "Footprint", "Datasheet", "D", "power");
		InternTable table = InternTable.of(keys);

		assertThat(table.size()).isEqualTo(6);
		for (String key : keys) {
			assertThat(table.find(new StringBuilder(key))).isSameAs(key);
		}
		assertThat(table.find("Valu")).isNull();
		assertThat(table.find("")).isNull();
	}

	@Test
	void duplicatesAreStoredOnce() {
		InternTable table = InternTable.of(List.of("D", "D", "E"));

		assertThat(table.size()).isEqualTo(2);
	}

	@Test
	void emptyTableFindsNothing() {
		assertThat(InternTable.of(List.of()).find("Value")).isNull();
	}
}
