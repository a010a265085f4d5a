package fangless.ast;

import java.util.List;

/**
 * Root of a parsed source file: the ordered top-level statements.
 */
public record Module(List<Stmt> body, SourcePosition position) implements Node {
	public Module {
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitModule(this);
	}
}
