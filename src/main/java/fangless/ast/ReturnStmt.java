package fangless.ast;

/**
 * {@code return} with an optional value; a bare return has a null value.
 */
public record ReturnStmt(Expr value, SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitReturnStmt(this);
	}
}
