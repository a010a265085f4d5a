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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts an AST into nested ordered maps and lists.
 *
 * Each node becomes a map with {@code _type}, its fields in declaration order, then {@code line}
 * and {@code col} when the node has a position. Operators are written as their source symbol.
 */
public final class AstSerializer implements AstVisitor<Map<String, Object>> {
	public Map<String, Object> toMap(Node node) {
		return node.accept(this);
	}

	private Object convert(Node node) {
		return node == null ? null : node.accept(this);
	}

	private List<Object> convertAll(List<? extends Node> nodes) {
		List<Object> out = new ArrayList<>(nodes.size());
		for (Node n : nodes) {
			out.add(convert(n));
		}
		return out;
	}

	private static Map<String, Object> node(String type) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("_type", type);
		return map;
	}

	private static Map<String, Object> positioned(Map<String, Object> map, SourcePosition pos) {
		if (pos != null && pos.isPresent()) {
			map.put("line", pos.line());
			map.put("col", pos.column());
		}
		return map;
	}

	@Override
	public Map<String, Object> visitModule(Module n) {
		Map<String, Object> map = node("Module");
		map.put("body", convertAll(n.body()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitBlock(Block n) {
		Map<String, Object> map = node("Block");
		map.put("statements", convertAll(n.statements()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitElifClause(ElifClause n) {
		Map<String, Object> map = node("ElifClause");
		map.put("cond", convert(n.cond()));
		map.put("body", convert(n.body()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitParameter(Parameter n) {
		Map<String, Object> map = node("Parameter");
		map.put("name", n.name());
		map.put("default", convert(n.defaultValue()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitDictEntry(DictEntry n) {
		Map<String, Object> map = node("DictEntry");
		map.put("key", convert(n.key()));
		map.put("value", convert(n.value()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitExprStmt(ExprStmt n) {
		Map<String, Object> map = node("ExprStmt");
		map.put("value", convert(n.value()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitAssignStmt(AssignStmt n) {
		Map<String, Object> map = node("Assign");
		map.put("target", convert(n.target()));
		map.put("op", n.op().symbol());
		map.put("value", convert(n.value()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitReturnStmt(ReturnStmt n) {
		Map<String, Object> map = node("Return");
		map.put("value", convert(n.value()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitBreakStmt(BreakStmt n) {
		return positioned(node("Break"), n.position());
	}

	@Override
	public Map<String, Object> visitContinueStmt(ContinueStmt n) {
		return positioned(node("Continue"), n.position());
	}

	@Override
	public Map<String, Object> visitPassStmt(PassStmt n) {
		return positioned(node("Pass"), n.position());
	}

	@Override
	public Map<String, Object> visitIfStmt(IfStmt n) {
		Map<String, Object> map = node("If");
		map.put("cond", convert(n.cond()));
		map.put("body", convert(n.body()));
		map.put("elifs", convertAll(n.elifs()));
		map.put("orelse", convert(n.orElse()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitWhileStmt(WhileStmt n) {
		Map<String, Object> map = node("While");
		map.put("cond", convert(n.cond()));
		map.put("body", convert(n.body()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitForStmt(ForStmt n) {
		Map<String, Object> map = node("For");
		map.put("target", convert(n.target()));
		map.put("iterable", convert(n.iterable()));
		map.put("body", convert(n.body()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitFunctionDef(FunctionDef n) {
		Map<String, Object> map = node("FunctionDef");
		map.put("name", n.name());
		map.put("params", convertAll(n.params()));
		map.put("body", convert(n.body()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitClassDef(ClassDef n) {
		Map<String, Object> map = node("ClassDef");
		map.put("name", n.name());
		map.put("body", convert(n.body()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitLiteral(LiteralExpr n) {
		Map<String, Object> map = node("Literal");
		map.put("value", n.value());
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitIdentifier(Identifier n) {
		Map<String, Object> map = node("Identifier");
		map.put("name", n.name());
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitUnary(UnaryExpr n) {
		Map<String, Object> map = node("Unary");
		map.put("op", n.op().symbol());
		map.put("operand", convert(n.operand()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitBinary(BinaryExpr n) {
		Map<String, Object> map = node("Binary");
		map.put("left", convert(n.left()));
		map.put("op", n.op().symbol());
		map.put("right", convert(n.right()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitComparison(ComparisonExpr n) {
		Map<String, Object> map = node("Comparison");
		map.put("left", convert(n.left()));
		map.put("op", n.op().symbol());
		map.put("right", convert(n.right()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitCall(CallExpr n) {
		Map<String, Object> map = node("Call");
		map.put("callee", convert(n.callee()));
		map.put("args", convertAll(n.args()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitAttribute(AttributeExpr n) {
		Map<String, Object> map = node("Attribute");
		map.put("value", convert(n.value()));
		map.put("attr", n.attr());
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitSubscript(SubscriptExpr n) {
		Map<String, Object> map = node("Subscript");
		map.put("value", convert(n.value()));
		map.put("index", convert(n.index()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitSlice(SliceExpr n) {
		Map<String, Object> map = node("Slice");
		map.put("lower", convert(n.lower()));
		map.put("upper", convert(n.upper()));
		map.put("step", convert(n.step()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitTuple(TupleExpr n) {
		Map<String, Object> map = node("Tuple");
		map.put("elements", convertAll(n.elements()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitList(ListExpr n) {
		Map<String, Object> map = node("List");
		map.put("elements", convertAll(n.elements()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitSet(SetExpr n) {
		Map<String, Object> map = node("Set");
		map.put("elements", convertAll(n.elements()));
		return positioned(map, n.position());
	}

	@Override
	public Map<String, Object> visitDict(DictExpr n) {
		Map<String, Object> map = node("Dict");
		map.put("entries", convertAll(n.entries()));
		return positioned(map, n.position());
	}
}
