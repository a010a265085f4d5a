package fangless.parse;

import fangless.diag.Diagnostics;
import fangless.diag.Stage;

/**
 * Turns leading whitespace into INDENT/DEDENT tokens.
 *
 * Every operation mutates only the {@link IndentationState} it is given and queues synthetic
 * tokens on {@code state.pending}; the lexer drains that queue before scanning further.
 */
public final class IndentationTracker {
	public static final int DEFAULT_TAB_WIDTH = 4;

	private final int tabWidth;
	private final boolean strict;
	private final Diagnostics diagnostics;

	public IndentationTracker(int tabWidth, boolean strict, Diagnostics diagnostics) {
		if (tabWidth <= 0) {
			throw new IllegalArgumentException("tab width must be positive: " + tabWidth);
		}
		this.tabWidth = tabWidth;
		this.strict = strict;
		this.diagnostics = diagnostics;
	}

	public int tabWidth() {
		return tabWidth;
	}

	/**
	 * Logical width of a run of leading whitespace. A tab counts as a full tab width wherever it
	 * appears, a space as one column.
	 */
	public int measure(CharSequence whitespace) {
		int width = 0;
		for (int i = 0; i < whitespace.length(); i++) {
			width += whitespace.charAt(i) == '\t' ? tabWidth : 1;
		}
		return width;
	}

	/**
	 * Blank and comment-only lines never change the indentation level.
	 */
	public static boolean isTransparent(int lookahead) {
		return lookahead == -1 || lookahead == '\n' || lookahead == '\r' || lookahead == '#';
	}

	/**
	 * Evaluates the indentation of a line that starts with real content.
	 *
	 * @param width  logical width of the leading whitespace
	 * @param line   line number of the content
	 * @param column column of the first non-blank character
	 * @param offset source offset of the first non-blank character
	 */
	public void onLineStart(IndentationState state, int width, int line, int column, int offset) {
		if (state.delimiterDepth > 0) {
			return;
		}

		boolean expected = state.expectIndent;
		state.expectIndent = false;
		int top = state.stack.peek();

		if (width == top) {
			if (expected) {
				report("expected an indented block", line, column);
			}
			return;
		}

		if (width > top) {
			if (!expected) {
				report("unexpected indent", line, column);
			}
			if (width % tabWidth != 0) {
				report("indentation is not a multiple of " + tabWidth, line, column);
			} else if (strict && width - top > tabWidth) {
				report("indentation increased by more than one level", line, column);
			}
			state.stack.push(width);
			state.pending.add(Token.synthetic(TokenKind.INDENT, line, column, offset));
			return;
		}

		while (state.stack.peek() > width) {
			state.stack.pop();
			state.pending.add(Token.synthetic(TokenKind.DEDENT, line, column, offset));
		}
		if (state.stack.peek() != width) {
			report("unindent does not match any outer indentation level", line, column);
		}
	}

	/**
	 * Bookkeeping for every real token the lexer hands out: delimiter nesting and whether the
	 * next line must open a block.
	 */
	public void onToken(IndentationState state, TokenKind kind) {
		if (kind.isOpeningDelimiter()) {
			state.delimiterDepth++;
		} else if (kind.isClosingDelimiter() && state.delimiterDepth > 0) {
			state.delimiterDepth--;
		}
		state.expectIndent = kind == TokenKind.COLON && state.delimiterDepth == 0;
	}

	/**
	 * Closes every open level with a DEDENT.
	 */
	public void onEndOfInput(IndentationState state, int line, int column, int offset) {
		while (state.stack.size() > 1) {
			state.stack.pop();
			state.pending.add(Token.synthetic(TokenKind.DEDENT, line, column, offset));
		}
		state.expectIndent = false;
	}

	private void report(String message, int line, int column) {
		diagnostics.report(Stage.LEXER, message, line, column);
	}
}
