package fangless.ast;

public record ComparisonExpr(Expr left, ComparisonOp op, Expr right, SourcePosition position) implements Expr {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitComparison(this);
	}
}
