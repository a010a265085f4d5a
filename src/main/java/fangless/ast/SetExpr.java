package fangless.ast;

import java.util.List;

public record SetExpr(List<Expr> elements, SourcePosition position) implements Expr {
	public SetExpr {
		elements = List.copyOf(elements);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitSet(this);
	}
}
