package fangless.ast;

public record ElifClause(Expr cond, Block body, SourcePosition position) implements Node {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitElifClause(this);
	}
}
