package fangless.ast;

public record SubscriptExpr(Expr value, Expr index, SourcePosition position) implements Expr {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitSubscript(this);
	}
}
