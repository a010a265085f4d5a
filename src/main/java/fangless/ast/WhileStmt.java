package fangless.ast;

public record WhileStmt(Expr cond, Block body, SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitWhileStmt(this);
	}
}
