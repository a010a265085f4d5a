package fangless;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args) {
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String out() {
		return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	private String err() {
		return err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	@Test
	void printsTreeForAValidFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("ok.flpy");
		Files.writeString(file, "x = 1\n");

		assertEquals(Main.OK, run(file.toString()));
		assertEquals("Module\n  body:\n    Assign op='='\n      target: Identifier name='x'\n"
				+ "      value: Literal value=1\n", out());
		assertEquals("", err());
	}

	@Test
	void reportsDiagnosticsForAnInvalidFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("bad.flpy");
		Files.writeString(file, "x = 5 @ 3\n");

		assertEquals(Main.INVALID_INPUT, run(file.toString()));
		assertTrue(err().contains("illegal character '@', line=1, column=7, type=lexer\nx = 5 @ 3\n      ^\n"), err());
		assertTrue(err().contains("type=parser"), err());
	}

	@Test
	void expressionAsJson() {
		assertEquals(Main.OK, run("--json", "--expr", "a + 1"));
		assertTrue(out().contains("\"_type\" : \"Binary\""), out());
	}

	@Test
	void tokensWithPositions() {
		assertEquals(Main.OK, run("--tokens", "--expr", "a + 1"));
		assertEquals("ID a @1:1\nPLUS + @1:3\nNUMBER 1 @1:5\n", out());
	}

	@Test
	void treeWithPositions() {
		assertEquals(Main.OK, run("--positions", "--expr", "x"));
		assertEquals("Identifier name='x' @1:1\n", out());
	}

	@Test
	void strictIndentationFlag() {
		assertEquals(Main.OK, run("--tokens", "--expr", "if x:\n        pass"));
		assertEquals(Main.INVALID_INPUT, run("--strict-indent", "--tokens", "--expr", "if x:\n        pass"));
	}

	@Test
	void usageErrors() {
		assertEquals(Main.USAGE, run());
		assertEquals(Main.USAGE, run("--tab-width"));
		assertEquals(Main.USAGE, run("--tab-width", "zero", "--expr", "x"));
		assertEquals(Main.USAGE, run("--bogus"));
		assertEquals(Main.USAGE, run("--expr", "x", "file.flpy"));
		assertTrue(err().contains("Usage: fangless"));
	}

	@Test
	void missingFile(@TempDir Path dir) {
		assertEquals(Main.USAGE, run(dir.resolve("missing.flpy").toString()));
		assertTrue(err().startsWith("cannot read "), err());
	}
}
