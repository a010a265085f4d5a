package fangless.ast;

public record UnaryExpr(UnaryOp op, Expr operand, SourcePosition position) implements Expr {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
