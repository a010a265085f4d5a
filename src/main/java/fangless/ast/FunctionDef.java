package fangless.ast;

import java.util.List;

public record FunctionDef(String name, List<Parameter> params, Block body, SourcePosition position) implements Stmt {
	public FunctionDef {
		params = List.copyOf(params);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFunctionDef(this);
	}
}
