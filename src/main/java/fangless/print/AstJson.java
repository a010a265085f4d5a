package fangless.print;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fangless.ast.Node;

import java.io.UncheckedIOException;

/**
 * JSON rendering of {@link AstSerializer} output.
 */
public final class AstJson {
	private static final ObjectMapper mapper = new ObjectMapper()
			.enable(SerializationFeature.INDENT_OUTPUT);

	private final AstSerializer serializer = new AstSerializer();

	public String write(Node node) {
		try {
			return mapper.writeValueAsString(serializer.toMap(node));
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException("Failed to serialise AST", e);
		}
	}
}
