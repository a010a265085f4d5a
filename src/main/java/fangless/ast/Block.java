package fangless.ast;

import java.util.List;

/**
 * Body of a compound statement. A one-line suite is a block with a single statement.
 */
public record Block(List<Stmt> statements, SourcePosition position) implements Node {
	public Block {
		statements = List.copyOf(statements);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBlock(this);
	}
}
