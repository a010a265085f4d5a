package fangless.ast;

/**
 * Function parameter, optionally with a default value (null when absent).
 */
public record Parameter(String name, Expr defaultValue, SourcePosition position) implements Node {
	public boolean hasDefault() {
		return defaultValue != null;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitParameter(this);
	}
}
