package fangless;

import fangless.diag.Diagnostic;
import fangless.parse.Token;

import java.util.List;

public record TokenizeResult(List<Token> tokens, List<Diagnostic> diagnostics) {
	public TokenizeResult {
		tokens = List.copyOf(tokens);
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean isValid() {
		return diagnostics.isEmpty();
	}
}
