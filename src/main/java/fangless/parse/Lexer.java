package fangless.parse;

import fangless.diag.Diagnostics;
import fangless.diag.Stage;
import fangless.symbol.SymbolTable;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

/**
 * Pull-based, indentation-aware lexer for Fangless Python.
 *
 * Notes:
 * - Never stops on an error: problems are reported to the shared {@link Diagnostics} and
 * scanning resumes after the offending text.
 * - Emits no NEWLINE tokens; line information on each token is enough for the parser.
 * - Once input is exhausted and every indentation level is closed, {@link #nextToken()} keeps
 * returning an EOF token.
 */
public final class Lexer {
	private static final TokenKind[] SYMBOLS = Arrays.stream(TokenKind.values())
			.filter(k -> k.lexeme() != null && !k.isKeyword())
			.sorted(Comparator.comparingInt((TokenKind k) -> k.lexeme().length()).reversed())
			.toArray(TokenKind[]::new);

	private final String input;
	private final Diagnostics diagnostics;
	private final IndentationTracker tracker;
	private final IndentationState state = new IndentationState();
	private final SymbolTable symbols = new SymbolTable();

	private int pos;
	private int line = 1;
	private int lineStart;
	private boolean inputClosed;
	private Token eof;

	public Lexer(String input, Diagnostics diagnostics) {
		this(input, diagnostics, IndentationTracker.DEFAULT_TAB_WIDTH, false);
	}

	public Lexer(String input, Diagnostics diagnostics, int tabWidth, boolean strictIndentation) {
		this.input = Objects.requireNonNull(input, "input");
		this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
		this.tracker = new IndentationTracker(tabWidth, strictIndentation, diagnostics);
	}

	public SymbolTable symbols() {
		return symbols;
	}

	public Token nextToken() {
		while (true) {
			if (state.hasPending()) {
				return state.nextPending();
			}
			if (state.atLineStart) {
				beginLine();
				continue;
			}
			if (pos >= input.length()) {
				if (!inputClosed) {
					inputClosed = true;
					tracker.onEndOfInput(state, line, column(), pos);
					continue;
				}
				if (eof == null) {
					eof = Token.synthetic(TokenKind.EOF, line, column(), pos);
				}
				return eof;
			}

			Token t = scan();
			if (t != null) {
				tracker.onToken(state, t.kind());
				return t;
			}
		}
	}

	private void beginLine() {
		state.atLineStart = false;
		int start = pos;
		while (pos < input.length() && (input.charAt(pos) == ' ' || input.charAt(pos) == '\t')) {
			pos++;
		}
		int lookahead = pos < input.length() ? input.charAt(pos) : -1;
		if (IndentationTracker.isTransparent(lookahead)) {
			return;
		}
		int width = tracker.measure(input.subSequence(start, pos));
		tracker.onLineStart(state, width, line, column(), pos);
	}

	/**
	 * Scans one raw token starting at {@code pos}.
	 *
	 * @return the token, or null when only whitespace, a comment, a newline or bad input was
	 *         consumed
	 */
	private Token scan() {
		char c = input.charAt(pos);

		if (c == '\n') {
			newline();
			return null;
		}
		if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
			pos++;
			return null;
		}
		if (c == '#') {
			while (pos < input.length() && input.charAt(pos) != '\n') {
				pos++;
			}
			return null;
		}
		if (isIdentifierStart(c)) {
			return identifier();
		}
		if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
			return number();
		}
		if (c == '"' || c == '\'') {
			return string(c);
		}

		for (TokenKind kind : SYMBOLS) {
			if (input.startsWith(kind.lexeme(), pos)) {
				return make(kind, kind.lexeme(), kind.lexeme(), pos + kind.lexeme().length());
			}
		}

		// whole code point, so a supplementary character is one error
		int cp = input.codePointAt(pos);
		diagnostics.report(Stage.LEXER, "illegal character '" + Character.toString(cp) + "'", line, column());
		pos += Character.charCount(cp);
		return null;
	}

	private void newline() {
		pos++;
		line++;
		lineStart = pos;
		if (state.delimiterDepth == 0) {
			state.atLineStart = true;
		}
	}

	private Token identifier() {
		int start = pos;
		pos++;
		while (pos < input.length()) {
			char ch = input.charAt(pos);
			if (isIdentifierStart(ch) || isDigit(ch)) {
				pos++;
			} else {
				break;
			}
		}
		String word = input.substring(start, pos);
		int col = start - lineStart + 1;
		TokenKind keyword = TokenKind.keyword(word);
		if (keyword != null) {
			return new Token(keyword, word, word, line, col, start, line);
		}
		symbols.declare(word, line, col, "identifier");
		return new Token(TokenKind.ID, word, word, line, col, start, line);
	}

	// (\d+(\.\d*)?|\.\d+)([eE][+-]?\d+)?
	private Token number() {
		int start = pos;
		boolean floating = false;
		while (isDigit(peek(0))) {
			pos++;
		}
		if (peek(0) == '.') {
			floating = true;
			pos++;
			while (isDigit(peek(0))) {
				pos++;
			}
		}
		if (peek(0) == 'e' || peek(0) == 'E') {
			int sign = (peek(1) == '+' || peek(1) == '-') ? 1 : 0;
			if (isDigit(peek(1 + sign))) {
				floating = true;
				pos += 1 + sign;
				while (isDigit(peek(0))) {
					pos++;
				}
			}
		}

		String text = input.substring(start, pos);
		Object value;
		if (floating) {
			value = Double.parseDouble(text);
		} else {
			// integers are unbounded; only those past long range need a BigInteger
			value = text.length() < 19 ? Long.valueOf(text) : integer(text);
		}
		return new Token(TokenKind.NUMBER, text, value, line, start - lineStart + 1, start, line);
	}

	private static Number integer(String digits) {
		BigInteger big = new BigInteger(digits);
		return big.bitLength() < Long.SIZE ? Long.valueOf(big.longValue()) : big;
	}

	private Token string(char quote) {
		int start = pos;
		int startLine = line;
		int col = start - lineStart + 1;
		boolean triple = peek(1) == quote && peek(2) == quote;
		int contentStart = start + (triple ? 3 : 1);

		int i = contentStart;
		int linesSeen = 0;
		int lastLineStart = lineStart;
		while (i < input.length()) {
			char ch = input.charAt(i);
			if (ch == '\\' && i + 1 < input.length() && (triple || input.charAt(i + 1) != '\n')) {
				if (input.charAt(i + 1) == '\n') {
					linesSeen++;
					lastLineStart = i + 2;
				}
				i += 2;
				continue;
			}
			if (ch == '\n') {
				if (!triple) {
					break;
				}
				linesSeen++;
				lastLineStart = i + 1;
				i++;
				continue;
			}
			if (ch == quote && (!triple || (i + 2 < input.length() && input.charAt(i + 1) == quote
					&& input.charAt(i + 2) == quote))) {
				int end = i + (triple ? 3 : 1);
				String raw = input.substring(start, end);
				String value = unescape(input.substring(contentStart, i));
				pos = end;
				line += linesSeen;
				lineStart = lastLineStart;
				return new Token(TokenKind.STRING, raw, value, startLine, col, start, line);
			}
			i++;
		}

		// unterminated: drop the rest of the opening line and carry on from there
		diagnostics.report(Stage.LEXER, "unterminated string literal", startLine, col);
		int newline = input.indexOf('\n', start);
		pos = newline < 0 ? input.length() : newline;
		return null;
	}

	/**
	 * Resolves {@code \\ \" \' \n \t \r}; any other backslash sequence is kept as written.
	 */
	static String unescape(String content) {
		if (content.indexOf('\\') < 0) {
			return content;
		}
		StringBuilder out = new StringBuilder(content.length());
		for (int i = 0; i < content.length(); i++) {
			char ch = content.charAt(i);
			if (ch != '\\' || i + 1 >= content.length()) {
				out.append(ch);
				continue;
			}
			char next = content.charAt(i + 1);
			switch (next) {
				case '\\':
					out.append('\\');
					break;
				case '"':
					out.append('"');
					break;
				case '\'':
					out.append('\'');
					break;
				case 'n':
					out.append('\n');
					break;
				case 't':
					out.append('\t');
					break;
				case 'r':
					out.append('\r');
					break;
				default:
					out.append('\\').append(next);
					break;
			}
			i++;
		}
		return out.toString();
	}

	private Token make(TokenKind kind, String text, Object value, int end) {
		int start = pos;
		pos = end;
		return new Token(kind, text, value, line, start - lineStart + 1, start, line);
	}

	private int column() {
		return pos - lineStart + 1;
	}

	private int peek(int ahead) {
		int i = pos + ahead;
		return i < input.length() ? input.charAt(i) : -1;
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	// [A-Za-z_]
	private static boolean isIdentifierStart(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}
}
