package fangless.parse;

import fangless.ast.AssignOp;
import fangless.ast.AssignStmt;
import fangless.ast.AttributeExpr;
import fangless.ast.BinaryExpr;
import fangless.ast.BinaryOp;
import fangless.ast.BreakStmt;
import fangless.ast.CallExpr;
import fangless.ast.ClassDef;
import fangless.ast.ComparisonExpr;
import fangless.ast.ComparisonOp;
import fangless.ast.ContinueStmt;
import fangless.ast.DictExpr;
import fangless.ast.Expr;
import fangless.ast.ExprStmt;
import fangless.ast.ForStmt;
import fangless.ast.FunctionDef;
import fangless.ast.Identifier;
import fangless.ast.IfStmt;
import fangless.ast.ListExpr;
import fangless.ast.LiteralExpr;
import fangless.ast.Module;
import fangless.ast.PassStmt;
import fangless.ast.ReturnStmt;
import fangless.ast.SetExpr;
import fangless.ast.SliceExpr;
import fangless.ast.SourcePosition;
import fangless.ast.SubscriptExpr;
import fangless.ast.TupleExpr;
import fangless.ast.UnaryExpr;
import fangless.ast.UnaryOp;
import fangless.ast.WhileStmt;
import fangless.diag.Diagnostics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParserTest {
	private static Module parse(String input) {
		Diagnostics diagnostics = new Diagnostics(input);
		Module module = new Parser(new Lexer(input, diagnostics), diagnostics).parseModule();
		assertTrue(diagnostics.isEmpty(), () -> "unexpected diagnostics: " + diagnostics.all());
		return module;
	}

	private static Expr expr(String input) {
		Diagnostics diagnostics = new Diagnostics(input);
		Expr expr = new Parser(new Lexer(input, diagnostics), diagnostics).parseExpressionInput();
		assertTrue(diagnostics.isEmpty(), () -> "unexpected diagnostics: " + diagnostics.all());
		return expr;
	}

	private static void assertName(String name, Expr e) {
		assertEquals(name, assertInstanceOf(Identifier.class, e).name());
	}

	private static void assertLiteral(Object value, Expr e) {
		assertEquals(value, assertInstanceOf(LiteralExpr.class, e).value());
	}

	@Test
	void emptyModule() {
		Module module = parse("");
		assertTrue(module.body().isEmpty());
		assertEquals(new SourcePosition(1, 1), module.position());
	}

	@Test
	void assignmentWithPrecedence() {
		Module module = parse("x = 1 + 2 * 3");
		assertEquals(1, module.body().size());

		AssignStmt assign = assertInstanceOf(AssignStmt.class, module.body().get(0));
		assertName("x", assign.target());
		assertEquals(AssignOp.ASSIGN, assign.op());

		BinaryExpr sum = assertInstanceOf(BinaryExpr.class, assign.value());
		assertEquals(BinaryOp.ADD, sum.op());
		assertLiteral(1L, sum.left());
		BinaryExpr product = assertInstanceOf(BinaryExpr.class, sum.right());
		assertEquals(BinaryOp.MUL, product.op());
		assertLiteral(2L, product.left());
		assertLiteral(3L, product.right());
	}

	@Test
	void augmentedAssignment() {
		AssignStmt assign = assertInstanceOf(AssignStmt.class, parse("total //= 2").body().get(0));
		assertEquals(AssignOp.FLOOR_DIV_ASSIGN, assign.op());
		assertName("total", assign.target());
	}

	@Test
	void assignmentToAttributeSubscriptAndTuple() {
		Module module = parse("a.b = 1\nc[0] = 2\nd, e = 3, 4");
		assertInstanceOf(AttributeExpr.class, ((AssignStmt) module.body().get(0)).target());
		assertInstanceOf(SubscriptExpr.class, ((AssignStmt) module.body().get(1)).target());

		AssignStmt unpack = (AssignStmt) module.body().get(2);
		assertEquals(2, assertInstanceOf(TupleExpr.class, unpack.target()).elements().size());
		assertEquals(2, assertInstanceOf(TupleExpr.class, unpack.value()).elements().size());
	}

	@Test
	void subtractionIsLeftAssociative() {
		BinaryExpr outer = assertInstanceOf(BinaryExpr.class, expr("a - b - c"));
		assertName("c", outer.right());
		BinaryExpr inner = assertInstanceOf(BinaryExpr.class, outer.left());
		assertName("a", inner.left());
		assertName("b", inner.right());
	}

	@Test
	void powerIsRightAssociative() {
		BinaryExpr outer = assertInstanceOf(BinaryExpr.class, expr("2 ** 3 ** 2"));
		assertEquals(BinaryOp.POW, outer.op());
		assertLiteral(2L, outer.left());
		BinaryExpr inner = assertInstanceOf(BinaryExpr.class, outer.right());
		assertLiteral(3L, inner.left());
	}

	@Test
	void unaryMinusBindsLooserThanPower() {
		UnaryExpr neg = assertInstanceOf(UnaryExpr.class, expr("-2 ** 2"));
		assertEquals(UnaryOp.MINUS, neg.op());
		assertEquals(BinaryOp.POW, assertInstanceOf(BinaryExpr.class, neg.operand()).op());
	}

	@Test
	void signedExponent() {
		BinaryExpr pow = assertInstanceOf(BinaryExpr.class, expr("2 ** -1"));
		assertEquals(UnaryOp.MINUS, assertInstanceOf(UnaryExpr.class, pow.right()).op());
	}

	@Test
	void booleanOperators() {
		BinaryExpr or = assertInstanceOf(BinaryExpr.class, expr("a or b and c"));
		assertEquals(BinaryOp.OR, or.op());
		assertName("a", or.left());
		assertEquals(BinaryOp.AND, assertInstanceOf(BinaryExpr.class, or.right()).op());
	}

	@Test
	void notBindsLooserThanComparison() {
		UnaryExpr not = assertInstanceOf(UnaryExpr.class, expr("not a == b"));
		assertEquals(UnaryOp.NOT, not.op());
		assertEquals(ComparisonOp.EQ, assertInstanceOf(ComparisonExpr.class, not.operand()).op());
	}

	@Test
	void membershipTests() {
		assertEquals(ComparisonOp.IN, assertInstanceOf(ComparisonExpr.class, expr("x in xs")).op());
		assertEquals(ComparisonOp.NOT_IN, assertInstanceOf(ComparisonExpr.class, expr("x not in xs")).op());
	}

	@Test
	void chainedComparisonsNestToTheLeft() {
		ComparisonExpr outer = assertInstanceOf(ComparisonExpr.class, expr("a < b <= c"));
		assertEquals(ComparisonOp.LE, outer.op());
		assertEquals(ComparisonOp.LT, assertInstanceOf(ComparisonExpr.class, outer.left()).op());
	}

	@Test
	void postfixChain() {
		AttributeExpr attr = assertInstanceOf(AttributeExpr.class, expr("f(1, 2)[0].name"));
		assertEquals("name", attr.attr());
		SubscriptExpr sub = assertInstanceOf(SubscriptExpr.class, attr.value());
		assertLiteral(0L, sub.index());
		CallExpr call = assertInstanceOf(CallExpr.class, sub.value());
		assertName("f", call.callee());
		assertEquals(2, call.args().size());
	}

	@Test
	void methodCallWithTrailingComma() {
		CallExpr call = assertInstanceOf(CallExpr.class, expr("items.append(x,)"));
		assertEquals(1, call.args().size());
		assertEquals("append", assertInstanceOf(AttributeExpr.class, call.callee()).attr());
	}

	@Test
	void slices() {
		SliceExpr full = assertInstanceOf(SliceExpr.class,
				assertInstanceOf(SubscriptExpr.class, expr("a[1:2:3]")).index());
		assertLiteral(1L, full.lower());
		assertLiteral(2L, full.upper());
		assertLiteral(3L, full.step());

		SliceExpr step = assertInstanceOf(SliceExpr.class, assertInstanceOf(SubscriptExpr.class, expr("a[::2]")).index());
		assertNull(step.lower());
		assertNull(step.upper());
		assertLiteral(2L, step.step());

		SliceExpr all = assertInstanceOf(SliceExpr.class, assertInstanceOf(SubscriptExpr.class, expr("a[:]")).index());
		assertNull(all.lower());
		assertNull(all.upper());
		assertNull(all.step());

		SliceExpr tail = assertInstanceOf(SliceExpr.class, assertInstanceOf(SubscriptExpr.class, expr("a[1:]")).index());
		assertLiteral(1L, tail.lower());
		assertNull(tail.upper());
	}

	@Test
	void parenthesesAndTuples() {
		assertLiteral(1L, expr("(1)"));
		assertTrue(assertInstanceOf(TupleExpr.class, expr("()")).elements().isEmpty());
		assertEquals(1, assertInstanceOf(TupleExpr.class, expr("(1,)")).elements().size());
		assertEquals(3, assertInstanceOf(TupleExpr.class, expr("(1, 2, 3)")).elements().size());
		assertEquals(2, assertInstanceOf(TupleExpr.class, expr("1, 2")).elements().size());
	}

	@Test
	void groupingOverridesPrecedence() {
		BinaryExpr product = assertInstanceOf(BinaryExpr.class, expr("(1 + 2) * 3"));
		assertEquals(BinaryOp.MUL, product.op());
		assertEquals(BinaryOp.ADD, assertInstanceOf(BinaryExpr.class, product.left()).op());
	}

	@Test
	void collectionDisplays() {
		ListExpr list = assertInstanceOf(ListExpr.class, expr("[1, [2, 3], (4, 5)]"));
		assertEquals(3, list.elements().size());
		assertInstanceOf(ListExpr.class, list.elements().get(1));
		assertInstanceOf(TupleExpr.class, list.elements().get(2));

		assertTrue(assertInstanceOf(ListExpr.class, expr("[]")).elements().isEmpty());
		assertTrue(assertInstanceOf(DictExpr.class, expr("{}")).entries().isEmpty());
		assertEquals(2, assertInstanceOf(SetExpr.class, expr("{1, 2}")).elements().size());

		DictExpr dict = assertInstanceOf(DictExpr.class, expr("{'a': 1, 'b': {'c': 2},}"));
		assertEquals(2, dict.entries().size());
		assertLiteral("a", dict.entries().get(0).key());
		assertInstanceOf(DictExpr.class, dict.entries().get(1).value());
	}

	@Test
	void literals() {
		assertLiteral(true, expr("True"));
		assertLiteral(false, expr("False"));
		assertTrue(assertInstanceOf(LiteralExpr.class, expr("None")).isNone());
		assertLiteral(2.5, expr("2.5"));
		assertLiteral("s", expr("'s'"));
	}

	@Test
	void displaysMaySpanLines() {
		Module module = parse("xs = [\n    1,\n  2,\n]\ny = 3");
		assertEquals(2, module.body().size());
		assertEquals(2, assertInstanceOf(ListExpr.class, ((AssignStmt) module.body().get(0)).value()).elements().size());
	}

	@Test
	void functionDefinition() {
		Module module = parse("def add(a, b=1):\n    return a + b\n");
		FunctionDef def = assertInstanceOf(FunctionDef.class, module.body().get(0));
		assertEquals("add", def.name());
		assertEquals(2, def.params().size());
		assertEquals("a", def.params().get(0).name());
		assertNull(def.params().get(0).defaultValue());
		assertTrue(def.params().get(1).hasDefault());

		ReturnStmt ret = assertInstanceOf(ReturnStmt.class, def.body().statements().get(0));
		assertEquals(BinaryOp.ADD, assertInstanceOf(BinaryExpr.class, ret.value()).op());
		assertEquals(new SourcePosition(1, 1), def.position());
		assertEquals(new SourcePosition(2, 5), def.body().position());
	}

	@Test
	void functionWithoutParametersAndBareReturn() {
		FunctionDef def = assertInstanceOf(FunctionDef.class, parse("def f():\n    return\n").body().get(0));
		assertTrue(def.params().isEmpty());
		assertNull(assertInstanceOf(ReturnStmt.class, def.body().statements().get(0)).value());
	}

	@Test
	void classDefinition() {
		ClassDef cls = assertInstanceOf(ClassDef.class, parse("class Point:\n    x = 0\n    y = 0\n").body().get(0));
		assertEquals("Point", cls.name());
		assertEquals(2, cls.body().statements().size());
	}

	@Test
	void ifElifElse() {
		String input = "if a:\n    x = 1\nelif b:\n    x = 2\nelif c:\n    x = 3\nelse:\n    x = 4\n";
		IfStmt stmt = assertInstanceOf(IfStmt.class, parse(input).body().get(0));
		assertName("a", stmt.cond());
		assertEquals(2, stmt.elifs().size());
		assertName("c", stmt.elifs().get(1).cond());
		assertEquals(1, stmt.orElse().statements().size());
	}

	@Test
	void ifWithoutElse() {
		IfStmt stmt = assertInstanceOf(IfStmt.class, parse("if a:\n    pass\nb = 1").body().get(0));
		assertTrue(stmt.elifs().isEmpty());
		assertNull(stmt.orElse());
	}

	@Test
	void loopsWithControlFlow() {
		String input = "for i in range(10):\n"
				+ "    if i % 2 == 0:\n"
				+ "        continue\n"
				+ "    elif i > 7:\n"
				+ "        break\n"
				+ "    else:\n"
				+ "        pass\n";
		ForStmt loop = assertInstanceOf(ForStmt.class, parse(input).body().get(0));
		assertEquals("i", loop.target().name());
		assertInstanceOf(CallExpr.class, loop.iterable());

		IfStmt branch = assertInstanceOf(IfStmt.class, loop.body().statements().get(0));
		assertInstanceOf(ContinueStmt.class, branch.body().statements().get(0));
		assertInstanceOf(BreakStmt.class, branch.elifs().get(0).body().statements().get(0));
		assertInstanceOf(PassStmt.class, branch.orElse().statements().get(0));
	}

	@Test
	void singleLineSuite() {
		WhileStmt loop = assertInstanceOf(WhileStmt.class, parse("while True: pass\nx = 1").body().get(0));
		assertInstanceOf(PassStmt.class, loop.body().statements().get(0));
	}

	@Test
	void deeplyNestedProgram() {
		String input = "data = {\"a\": [1, 2, (3, 4)], \"b\": {\"c\": {1, 2}}}\n"
				+ "for k in data:\n"
				+ "    while k:\n"
				+ "        if k == \"a\":\n"
				+ "            k = None\n"
				+ "        else:\n"
				+ "            k = False\n"
				+ "print(k)\n";
		Module module = parse(input);
		assertEquals(3, module.body().size());
		assertInstanceOf(ExprStmt.class, module.body().get(2));

		ForStmt loop = (ForStmt) module.body().get(1);
		WhileStmt inner = assertInstanceOf(WhileStmt.class, loop.body().statements().get(0));
		IfStmt branch = assertInstanceOf(IfStmt.class, inner.body().statements().get(0));
		assertEquals(1, branch.orElse().statements().size());
	}

	@Test
	void commentsAndBlankLinesBetweenStatements() {
		Module module = parse("# header\n\nx = 1  # trailing\n\n\ny = 2\n");
		assertEquals(2, module.body().size());
	}

	@Test
	void positionsFollowTheLeadingToken() {
		Module module = parse("x = 1\nfoo(bar)");
		assertEquals(new SourcePosition(1, 1), module.body().get(0).position());
		ExprStmt stmt = (ExprStmt) module.body().get(1);
		assertEquals(new SourcePosition(2, 1), stmt.position());
		assertEquals(new SourcePosition(2, 4), stmt.value().position());
	}
}
