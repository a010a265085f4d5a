package fangless.ast;

public record BinaryExpr(Expr left, BinaryOp op, Expr right, SourcePosition position) implements Expr {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBinary(this);
	}
}
