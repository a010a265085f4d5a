package fangless;

import fangless.ast.Module;
import fangless.diag.Diagnostic;

import java.util.List;

/**
 * Outcome of parsing a source file.
 *
 * The module is never null; when {@link #isValid()} is false it may be missing the statements that
 * could not be parsed.
 */
public record ParseResult(Module module, List<Diagnostic> diagnostics) {
	public ParseResult {
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean isValid() {
		return diagnostics.isEmpty();
	}
}
