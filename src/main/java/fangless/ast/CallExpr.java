package fangless.ast;

import java.util.List;

public record CallExpr(Expr callee, List<Expr> args, SourcePosition position) implements Expr {
	public CallExpr {
		args = List.copyOf(args);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
