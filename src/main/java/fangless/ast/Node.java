package fangless.ast;

public sealed interface Node permits Module, Block, Stmt, Expr, ElifClause, Parameter, DictEntry {
	SourcePosition position();

	<R> R accept(AstVisitor<R> visitor);
}
