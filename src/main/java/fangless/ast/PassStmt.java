package fangless.ast;

public record PassStmt(SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitPassStmt(this);
	}
}
