package fangless;

import fangless.ast.Expr;
import fangless.ast.Module;
import fangless.diag.Diagnostics;
import fangless.parse.Lexer;
import fangless.parse.Parser;
import fangless.parse.Token;
import fangless.parse.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry points of the Fangless Python front-end.
 *
 * Every call builds a fresh lexer, indentation state, symbol table and diagnostic list, so
 * repeated calls on the same text give identical results.
 */
public final class Frontend {
	private final FrontendOptions options;

	public Frontend() {
		this(FrontendOptions.defaults());
	}

	public Frontend(FrontendOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	public FrontendOptions options() {
		return options;
	}

	public TokenizeResult tokenize(String source) {
		Diagnostics diagnostics = new Diagnostics(Objects.requireNonNull(source, "source"));
		Lexer lexer = newLexer(source, diagnostics);
		List<Token> tokens = new ArrayList<>();
		for (Token t = lexer.nextToken(); !t.is(TokenKind.EOF); t = lexer.nextToken()) {
			tokens.add(t);
		}
		return new TokenizeResult(tokens, diagnostics.all());
	}

	public ParseResult parse(String source) {
		Diagnostics diagnostics = new Diagnostics(Objects.requireNonNull(source, "source"));
		Parser parser = new Parser(newLexer(source, diagnostics), diagnostics);
		Module module = parser.parseModule();
		return new ParseResult(module, diagnostics.all());
	}

	/**
	 * Parses source holding a single expression, for REPL-style use.
	 */
	public ExpressionResult parseExpression(String source) {
		Diagnostics diagnostics = new Diagnostics(Objects.requireNonNull(source, "source"));
		Parser parser = new Parser(newLexer(source, diagnostics), diagnostics);
		Expr expr = parser.parseExpressionInput();
		return new ExpressionResult(expr, diagnostics.all());
	}

	private Lexer newLexer(String source, Diagnostics diagnostics) {
		return new Lexer(source, diagnostics, options.tabWidth(), options.strictIndentation());
	}
}
