package fangless.print;

import fangless.Frontend;
import fangless.ast.BinaryExpr;
import fangless.ast.BinaryOp;
import fangless.ast.Identifier;
import fangless.ast.LiteralExpr;
import fangless.ast.Module;
import fangless.ast.SourcePosition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstSerializerTest {
	private final AstSerializer serializer = new AstSerializer();

	@Test
	void fieldsComeInDeclarationOrder() {
		BinaryExpr sum = new BinaryExpr(new Identifier("a", new SourcePosition(1, 1)), BinaryOp.ADD,
				new LiteralExpr(1L, new SourcePosition(1, 5)), new SourcePosition(1, 1));
		Map<String, Object> map = serializer.toMap(sum);

		assertEquals(List.of("_type", "left", "op", "right", "line", "col"), List.copyOf(map.keySet()));
		assertEquals("Binary", map.get("_type"));
		assertEquals("+", map.get("op"));
		assertEquals(Map.of("_type", "Literal", "value", 1L, "line", 1, "col", 5), map.get("right"));
	}

	@Test
	void positionIsOmittedWhenAbsent() {
		Map<String, Object> map = serializer.toMap(new Identifier("x", SourcePosition.NONE));
		assertEquals(Map.of("_type", "Identifier", "name", "x"), map);
		assertFalse(map.containsKey("line"));
	}

	@Test
	void missingChildrenAreNull() {
		Module module = new Frontend().parse("if a:\n    return\n").module();
		Map<String, Object> ifMap = serializer.toMap(module.body().get(0));

		assertEquals("If", ifMap.get("_type"));
		assertTrue(ifMap.containsKey("orelse"));
		assertNull(ifMap.get("orelse"));
		assertEquals(List.of(), ifMap.get("elifs"));
	}

	@Test
	void jsonOutput() {
		String json = new AstJson().write(new Frontend().parse("x = None").module());
		assertTrue(json.contains("\"_type\" : \"Assign\""), json);
		assertTrue(json.contains("\"value\" : null"), json);
		assertTrue(json.contains("\"op\" : \"=\""), json);
	}
}
