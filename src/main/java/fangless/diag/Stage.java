package fangless.diag;

/**
 * Front-end stage that reported a diagnostic.
 */
public enum Stage {
	LEXER("lexer"),
	PARSER("parser");

	private final String label;

	Stage(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
