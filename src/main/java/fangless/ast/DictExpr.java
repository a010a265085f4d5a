package fangless.ast;

import java.util.List;

public record DictExpr(List<DictEntry> entries, SourcePosition position) implements Expr {
	public DictExpr {
		entries = List.copyOf(entries);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitDict(this);
	}
}
