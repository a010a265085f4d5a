package fangless.print;

import fangless.ast.AssignStmt;
import fangless.ast.AstVisitor;
import fangless.ast.AttributeExpr;
import fangless.ast.BinaryExpr;
import fangless.ast.Block;
import fangless.ast.BreakStmt;
import fangless.ast.CallExpr;
import fangless.ast.ClassDef;
import fangless.ast.ComparisonExpr;
import fangless.ast.ContinueStmt;
import fangless.ast.DictEntry;
import fangless.ast.DictExpr;
import fangless.ast.ElifClause;
import fangless.ast.ExprStmt;
import fangless.ast.ForStmt;
import fangless.ast.FunctionDef;
import fangless.ast.Identifier;
import fangless.ast.IfStmt;
import fangless.ast.ListExpr;
import fangless.ast.LiteralExpr;
import fangless.ast.Module;
import fangless.ast.Node;
import fangless.ast.Parameter;
import fangless.ast.PassStmt;
import fangless.ast.ReturnStmt;
import fangless.ast.SetExpr;
import fangless.ast.SliceExpr;
import fangless.ast.SourcePosition;
import fangless.ast.SubscriptExpr;
import fangless.ast.TupleExpr;
import fangless.ast.UnaryExpr;
import fangless.ast.WhileStmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Indented text rendering of an AST, one node per line.
 *
 * Scalar fields, and child fields that are absent, are printed inline ({@code Assign op='='},
 * {@code Return value=None}); child nodes go on the lines below, prefixed with their field name.
 * Field order follows {@link AstSerializer}.
 */
public final class AstPrinter implements AstVisitor<Void> {
	private static final String INDENT = "  ";
	private static final String NL = System.lineSeparator();

	private final boolean withPositions;

	private StringBuilder out;
	private int depth;
	private String label;

	public AstPrinter() {
		this(false);
	}

	public AstPrinter(boolean withPositions) {
		this.withPositions = withPositions;
	}

	public String print(Node node) {
		out = new StringBuilder();
		depth = 0;
		label = null;
		node.accept(this);
		return out.toString();
	}

	private Line line(String type, SourcePosition position) {
		return new Line(type, position);
	}

	/**
	 * One node: its header is collected first, children are printed after it by {@link #end()}.
	 */
	private final class Line {
		private final StringBuilder head = new StringBuilder();
		private final List<Runnable> children = new ArrayList<>();
		private final SourcePosition position;

		Line(String type, SourcePosition position) {
			this.position = position;
			head.append(INDENT.repeat(depth));
			if (label != null) {
				head.append(label).append(": ");
				label = null;
			}
			head.append(type);
		}

		Line scalar(String name, Object value) {
			head.append(' ').append(name).append('=').append(repr(value));
			return this;
		}

		Line child(String name, Node node) {
			if (node == null) {
				return scalar(name, null);
			}
			children.add(() -> {
				int saved = depth;
				depth = saved + 1;
				label = name;
				node.accept(AstPrinter.this);
				depth = saved;
			});
			return this;
		}

		Line children(String name, List<? extends Node> nodes) {
			children.add(() -> {
				out.append(INDENT.repeat(depth + 1)).append(name);
				if (nodes.isEmpty()) {
					out.append(": []").append(NL);
					return;
				}
				out.append(':').append(NL);
				int saved = depth;
				depth = saved + 2;
				for (Node n : nodes) {
					n.accept(AstPrinter.this);
				}
				depth = saved;
			});
			return this;
		}

		Void end() {
			if (withPositions && position != null && position.isPresent()) {
				head.append(" @").append(position.line()).append(':').append(position.column());
			}
			out.append(head).append(NL);
			for (Runnable child : children) {
				child.run();
			}
			return null;
		}
	}

	static String repr(Object value) {
		if (value == null) {
			return "None";
		}
		if (value instanceof Boolean b) {
			return b ? "True" : "False";
		}
		if (value instanceof String s) {
			return "'" + s.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t")
					.replace("\r", "\\r").replace("'", "\\'") + "'";
		}
		return value.toString();
	}

	@Override
	public Void visitModule(Module n) {
		return line("Module", n.position()).children("body", n.body()).end();
	}

	@Override
	public Void visitBlock(Block n) {
		return line("Block", n.position()).children("statements", n.statements()).end();
	}

	@Override
	public Void visitElifClause(ElifClause n) {
		return line("ElifClause", n.position()).child("cond", n.cond()).child("body", n.body()).end();
	}

	@Override
	public Void visitParameter(Parameter n) {
		return line("Parameter", n.position()).scalar("name", n.name()).child("default", n.defaultValue()).end();
	}

	@Override
	public Void visitDictEntry(DictEntry n) {
		return line("DictEntry", n.position()).child("key", n.key()).child("value", n.value()).end();
	}

	@Override
	public Void visitExprStmt(ExprStmt n) {
		return line("ExprStmt", n.position()).child("value", n.value()).end();
	}

	@Override
	public Void visitAssignStmt(AssignStmt n) {
		return line("Assign", n.position())
				.child("target", n.target())
				.scalar("op", n.op().symbol())
				.child("value", n.value())
				.end();
	}

	@Override
	public Void visitReturnStmt(ReturnStmt n) {
		return line("Return", n.position()).child("value", n.value()).end();
	}

	@Override
	public Void visitBreakStmt(BreakStmt n) {
		return line("Break", n.position()).end();
	}

	@Override
	public Void visitContinueStmt(ContinueStmt n) {
		return line("Continue", n.position()).end();
	}

	@Override
	public Void visitPassStmt(PassStmt n) {
		return line("Pass", n.position()).end();
	}

	@Override
	public Void visitIfStmt(IfStmt n) {
		return line("If", n.position())
				.child("cond", n.cond())
				.child("body", n.body())
				.children("elifs", n.elifs())
				.child("orelse", n.orElse())
				.end();
	}

	@Override
	public Void visitWhileStmt(WhileStmt n) {
		return line("While", n.position()).child("cond", n.cond()).child("body", n.body()).end();
	}

	@Override
	public Void visitForStmt(ForStmt n) {
		return line("For", n.position())
				.child("target", n.target())
				.child("iterable", n.iterable())
				.child("body", n.body())
				.end();
	}

	@Override
	public Void visitFunctionDef(FunctionDef n) {
		return line("FunctionDef", n.position())
				.scalar("name", n.name())
				.children("params", n.params())
				.child("body", n.body())
				.end();
	}

	@Override
	public Void visitClassDef(ClassDef n) {
		return line("ClassDef", n.position()).scalar("name", n.name()).child("body", n.body()).end();
	}

	@Override
	public Void visitLiteral(LiteralExpr n) {
		return line("Literal", n.position()).scalar("value", n.value()).end();
	}

	@Override
	public Void visitIdentifier(Identifier n) {
		return line("Identifier", n.position()).scalar("name", n.name()).end();
	}

	@Override
	public Void visitUnary(UnaryExpr n) {
		return line("Unary", n.position()).scalar("op", n.op().symbol()).child("operand", n.operand()).end();
	}

	@Override
	public Void visitBinary(BinaryExpr n) {
		return line("Binary", n.position())
				.child("left", n.left())
				.scalar("op", n.op().symbol())
				.child("right", n.right())
				.end();
	}

	@Override
	public Void visitComparison(ComparisonExpr n) {
		return line("Comparison", n.position())
				.child("left", n.left())
				.scalar("op", n.op().symbol())
				.child("right", n.right())
				.end();
	}

	@Override
	public Void visitCall(CallExpr n) {
		return line("Call", n.position()).child("callee", n.callee()).children("args", n.args()).end();
	}

	@Override
	public Void visitAttribute(AttributeExpr n) {
		return line("Attribute", n.position()).child("value", n.value()).scalar("attr", n.attr()).end();
	}

	@Override
	public Void visitSubscript(SubscriptExpr n) {
		return line("Subscript", n.position()).child("value", n.value()).child("index", n.index()).end();
	}

	@Override
	public Void visitSlice(SliceExpr n) {
		return line("Slice", n.position())
				.child("lower", n.lower())
				.child("upper", n.upper())
				.child("step", n.step())
				.end();
	}

	@Override
	public Void visitTuple(TupleExpr n) {
		return line("Tuple", n.position()).children("elements", n.elements()).end();
	}

	@Override
	public Void visitList(ListExpr n) {
		return line("List", n.position()).children("elements", n.elements()).end();
	}

	@Override
	public Void visitSet(SetExpr n) {
		return line("Set", n.position()).children("elements", n.elements()).end();
	}

	@Override
	public Void visitDict(DictExpr n) {
		return line("Dict", n.position()).children("entries", n.entries()).end();
	}
}
