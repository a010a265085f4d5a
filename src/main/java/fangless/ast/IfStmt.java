package fangless.ast;

import java.util.List;

/**
 * if / elif / else chain. {@code orElse} is null when there is no else clause.
 */
public record IfStmt(Expr cond, Block body, List<ElifClause> elifs, Block orElse, SourcePosition position)
		implements Stmt {
	public IfStmt {
		elifs = List.copyOf(elifs);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIfStmt(this);
	}
}
