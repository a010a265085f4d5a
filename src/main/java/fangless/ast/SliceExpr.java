package fangless.ast;

/**
 * {@code lower:upper:step} inside a subscript. Every part may be null.
 */
public record SliceExpr(Expr lower, Expr upper, Expr step, SourcePosition position) implements Expr {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitSlice(this);
	}
}
