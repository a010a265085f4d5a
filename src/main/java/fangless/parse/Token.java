package fangless.parse;

import fangless.ast.SourcePosition;

/**
 * Immutable lexer output.
 *
 * {@code value} holds the parsed payload: Long, BigInteger or Double for NUMBER, the unescaped text for STRING,
 * the lexeme for ID and keywords, null for synthetic tokens. {@code endLine} differs from {@code line}
 * only for triple-quoted strings spanning several lines.
 */
public record Token(TokenKind kind, String text, Object value, int line, int column, int offset, int endLine) {
	public static Token synthetic(TokenKind kind, int line, int column, int offset) {
		return new Token(kind, "", null, line, column, offset, line);
	}

	public SourcePosition position() {
		return new SourcePosition(line, column);
	}

	public boolean is(TokenKind k) {
		return kind == k;
	}

	/**
	 * Human readable description used in parser diagnostics, e.g. {@code ')'} or {@code number '42'}.
	 */
	public String describe() {
		switch (kind) {
			case ID:
				return "identifier '" + text + "'";
			case NUMBER:
				return "number '" + text + "'";
			case STRING:
				return "string " + text;
			case INDENT:
				return "indent";
			case DEDENT:
				return "dedent";
			case EOF:
				return "end of input";
			default:
				return "'" + kind.lexeme() + "'";
		}
	}

	@Override
	public String toString() {
		return kind + "(" + (kind.lexeme() != null ? kind.lexeme() : text) + ")@" + line + ":" + column;
	}
}
