package fangless.ast;

public record ClassDef(String name, Block body, SourcePosition position) implements Stmt {
	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitClassDef(this);
	}
}
