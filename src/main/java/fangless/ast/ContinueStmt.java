package fangless.ast;

public record ContinueStmt(SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitContinueStmt(this);
	}
}
