package fangless.ast;

public record DictEntry(Expr key, Expr value, SourcePosition position) implements Node {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitDictEntry(this);
	}
}
