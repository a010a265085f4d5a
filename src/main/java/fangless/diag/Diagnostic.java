package fangless.diag;

import java.util.Objects;

/**
 * A recorded, non-fatal error with its position and originating stage.
 *
 * {@code source} is the full source text when available; it is only used to render
 * {@link #expanded()} and does not take part in equality.
 */
public record Diagnostic(String message, int line, int column, Stage stage, String source) {
	public Diagnostic {
		Objects.requireNonNull(message, "message");
		Objects.requireNonNull(stage, "stage");
	}

	public Diagnostic(String message, int line, int column, Stage stage) {
		this(message, line, column, stage, null);
	}

	/**
	 * {@code <message>, line=<line>, column=<column>, type=<lexer|parser>}
	 */
	public String compact() {
		return message + ", line=" + line + ", column=" + column + ", type=" + stage.label();
	}

	/**
	 * Compact form followed by the offending source line and a caret under the error column.
	 */
	public String expanded() {
		String context = context();
		if (context == null) {
			return compact();
		}
		return compact() + System.lineSeparator() + context;
	}

	private String context() {
		if (source == null || line < 1) {
			return null;
		}
		String[] lines = source.split("\r?\n", -1);
		if (line > lines.length) {
			return null;
		}
		String errorLine = lines[line - 1];
		String stripped = errorLine.stripLeading();
		int indent = errorLine.length() - stripped.length();
		int caret = Math.max(0, column - 1 - indent);
		return stripped + System.lineSeparator() + " ".repeat(caret) + "^";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Diagnostic other)) {
			return false;
		}
		return line == other.line && column == other.column && message.equals(other.message)
				&& stage == other.stage;
	}

	@Override
	public int hashCode() {
		return Objects.hash(message, line, column, stage);
	}

	@Override
	public String toString() {
		return compact();
	}
}
