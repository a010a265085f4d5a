package fangless.ast;

public record Identifier(String name, SourcePosition position) implements Expr {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIdentifier(this);
	}
}
