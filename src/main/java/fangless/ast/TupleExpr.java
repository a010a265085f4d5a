package fangless.ast;

import java.util.List;

public record TupleExpr(List<Expr> elements, SourcePosition position) implements Expr {
	public TupleExpr {
		elements = List.copyOf(elements);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitTuple(this);
	}
}
