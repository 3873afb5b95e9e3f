package org.javai.kicad.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import org.javai.kicad.sexpr.Sexpr;
import org.javai.kicad.sexpr.SexprReader;
import org.javai.kicad.sexpr.SexprSyntaxException;

/**
 * Reads an opaque node back from the text written by {@link ListNodeSerializer}.
 */
class ListNodeDeserializer extends StdDeserializer<Sexpr.ListNode> {

	ListNodeDeserializer() {
		super(Sexpr.ListNode.class);
	}

	@Override
	public Sexpr.ListNode deserialize(JsonParser parser, DeserializationContext context) throws IOException {
		String text = parser.getValueAsString();
		try {
			if (SexprReader.read(text) instanceof Sexpr.ListNode list) {
				return list;
			}
		} catch (SexprSyntaxException e) {
			return (Sexpr.ListNode) context.handleWeirdStringValue(Sexpr.ListNode.class, text, e.getMessage());
		}
		return (Sexpr.ListNode) context.handleWeirdStringValue(Sexpr.ListNode.class, text, "not a list");
	}
}
