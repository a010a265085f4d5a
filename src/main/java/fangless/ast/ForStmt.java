package fangless.ast;

public record ForStmt(Identifier target, Expr iterable, Block body, SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitForStmt(this);
	}
}
