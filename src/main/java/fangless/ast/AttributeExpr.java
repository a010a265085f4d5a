package fangless.ast;

public record AttributeExpr(Expr value, String attr, SourcePosition position) implements Expr {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitAttribute(this);
	}
}
