package org.javai.kicad.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprWriter;

/**
 * Writes an opaque node as its compact text.
 */
class ListNodeSerializer extends StdSerializer<Sexpr.ListNode> {

	private static final SexprWriter WRITER = SexprWriter.compact();

	ListNodeSerializer() {
		super(Sexpr.ListNode.class);
	}

	@Override
	public void serialize(Sexpr.ListNode value, JsonGenerator generator, SerializerProvider provider) throws IOException {
		generator.writeString(WRITER.write(value));
	}
}
