package fangless.ast;

public record ExprStmt(Expr value, SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitExprStmt(this);
	}
}
