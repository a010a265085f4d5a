package fangless.ast;

import java.util.List;

public record ListExpr(List<Expr> elements, SourcePosition position) implements Expr {
	public ListExpr {
		elements = List.copyOf(elements);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitList(this);
	}
}
