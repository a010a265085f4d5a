package fangless.ast;

public record AssignStmt(Expr target, AssignOp op, Expr value, SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitAssignStmt(this);
	}
}
