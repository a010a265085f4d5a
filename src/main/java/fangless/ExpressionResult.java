package fangless;

import fangless.ast.Expr;
import fangless.diag.Diagnostic;

import java.util.List;

/**
 * Outcome of parsing a single expression. The expression is null when it could not be parsed.
 */
public record ExpressionResult(Expr expression, List<Diagnostic> diagnostics) {
	public ExpressionResult {
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean isValid() {
		return diagnostics.isEmpty();
	}
}
