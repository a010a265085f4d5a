package fangless.ast;

public record BreakStmt(SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBreakStmt(this);
	}
}
