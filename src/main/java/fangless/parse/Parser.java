package fangless.parse;

import fangless.ast.AssignOp;
import fangless.ast.AssignStmt;
import fangless.ast.AttributeExpr;
import fangless.ast.BinaryExpr;
import fangless.ast.BinaryOp;
import fangless.ast.Block;
import fangless.ast.BreakStmt;
import fangless.ast.CallExpr;
import fangless.ast.ClassDef;
import fangless.ast.ComparisonExpr;
import fangless.ast.ComparisonOp;
import fangless.ast.ContinueStmt;
import fangless.ast.DictEntry;
import fangless.ast.DictExpr;
import fangless.ast.ElifClause;
import fangless.ast.Expr;
import fangless.ast.ExprStmt;
import fangless.ast.ForStmt;
import fangless.ast.FunctionDef;
import fangless.ast.Identifier;
import fangless.ast.IfStmt;
import fangless.ast.ListExpr;
import fangless.ast.LiteralExpr;
import fangless.ast.Module;
import fangless.ast.Parameter;
import fangless.ast.PassStmt;
import fangless.ast.ReturnStmt;
import fangless.ast.SetExpr;
import fangless.ast.SliceExpr;
import fangless.ast.SourcePosition;
import fangless.ast.Stmt;
import fangless.ast.SubscriptExpr;
import fangless.ast.TupleExpr;
import fangless.ast.UnaryExpr;
import fangless.ast.UnaryOp;
import fangless.ast.WhileStmt;
import fangless.diag.Diagnostics;
import fangless.diag.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for Fangless Python.
 *
 * Precedence, loosest first: or, and, not, comparisons (including in / not in), + -, * / // %,
 * unary + -, ** (right-associative), postfix call / subscript / attribute, atoms.
 *
 * Syntax errors are reported to the shared {@link Diagnostics}; the parser then skips to the next
 * statement boundary and keeps going, so one pass finds every independent error. Nothing is
 * thrown to the caller for malformed input.
 */
public final class Parser {
	private static final Logger log = LoggerFactory.getLogger(Parser.class);

	// past these the parser reports an error instead of recursing further
	static final int MAX_EXPRESSION_DEPTH = 200;
	static final int MAX_BLOCK_DEPTH = 100;

	private static final Set<TokenKind> STATEMENT_KEYWORDS = EnumSet.of(
			TokenKind.IF, TokenKind.WHILE, TokenKind.FOR, TokenKind.DEF, TokenKind.CLASS,
			TokenKind.RETURN, TokenKind.BREAK, TokenKind.CONTINUE, TokenKind.PASS);

	private static final Map<TokenKind, AssignOp> ASSIGN_OPS = new EnumMap<>(TokenKind.class);
	private static final Map<TokenKind, ComparisonOp> COMPARISON_OPS = new EnumMap<>(TokenKind.class);

	static {
		ASSIGN_OPS.put(TokenKind.ASSIGN, AssignOp.ASSIGN);
		ASSIGN_OPS.put(TokenKind.PLUS_ASSIGN, AssignOp.ADD_ASSIGN);
		ASSIGN_OPS.put(TokenKind.MINUS_ASSIGN, AssignOp.SUB_ASSIGN);
		ASSIGN_OPS.put(TokenKind.TIMES_ASSIGN, AssignOp.MUL_ASSIGN);
		ASSIGN_OPS.put(TokenKind.DIVIDE_ASSIGN, AssignOp.DIV_ASSIGN);
		ASSIGN_OPS.put(TokenKind.FLOOR_DIVIDE_ASSIGN, AssignOp.FLOOR_DIV_ASSIGN);
		ASSIGN_OPS.put(TokenKind.MOD_ASSIGN, AssignOp.MOD_ASSIGN);
		ASSIGN_OPS.put(TokenKind.POWER_ASSIGN, AssignOp.POW_ASSIGN);

		COMPARISON_OPS.put(TokenKind.EQUALS, ComparisonOp.EQ);
		COMPARISON_OPS.put(TokenKind.NOT_EQUALS, ComparisonOp.NE);
		COMPARISON_OPS.put(TokenKind.LESS_THAN, ComparisonOp.LT);
		COMPARISON_OPS.put(TokenKind.LESS_THAN_EQUALS, ComparisonOp.LE);
		COMPARISON_OPS.put(TokenKind.GREATER_THAN, ComparisonOp.GT);
		COMPARISON_OPS.put(TokenKind.GREATER_THAN_EQUALS, ComparisonOp.GE);
		COMPARISON_OPS.put(TokenKind.IN, ComparisonOp.IN);
	}

	private final Lexer lexer;
	private final Diagnostics diagnostics;

	private Token current;
	private Token previous;
	// open ( [ { in the expression being parsed; inside them line breaks do not end anything
	private int nesting;
	private int expressionDepth;
	private int blockDepth;

	public Parser(Lexer lexer, Diagnostics diagnostics) {
		this.lexer = Objects.requireNonNull(lexer, "lexer");
		this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
		this.current = lexer.nextToken();
	}

	/**
	 * Parses a whole source file. Always returns a module, possibly missing the broken statements.
	 */
	public Module parseModule() {
		SourcePosition start = new SourcePosition(1, 1);
		List<Stmt> body = new ArrayList<>();
		while (!check(TokenKind.EOF)) {
			if (check(TokenKind.DEDENT)) {
				advance();
				continue;
			}
			statementInto(body);
		}
		return new Module(body, start);
	}

	/**
	 * Parses input holding exactly one expression, REPL style.
	 *
	 * @return the expression, or null when it could not be parsed
	 */
	public Expr parseExpressionInput() {
		while (check(TokenKind.INDENT)) {
			advance();
		}
		if (check(TokenKind.EOF) || check(TokenKind.DEDENT)) {
			report(current, "unexpected end of input, expected an expression");
			return null;
		}
		try {
			Expr expr = expressionList();
			while (check(TokenKind.DEDENT)) {
				advance();
			}
			if (!check(TokenKind.EOF)) {
				throw unexpected(current);
			}
			return expr;
		} catch (SyntaxError e) {
			return null;
		}
	}

	// ---- statements ----

	private void statementInto(List<Stmt> out) {
		if (check(TokenKind.INDENT)) {
			// the lexer has already reported this indent; keep its statements so their errors surface
			out.addAll(indentedBlock(advance()));
			return;
		}
		Token start = current;
		try {
			out.add(statement());
		} catch (SyntaxError e) {
			nesting = 0;
			synchronize(e.line);
			if (current == start && !check(TokenKind.DEDENT) && !check(TokenKind.EOF)) {
				advance();
			}
		}
	}

	private List<Stmt> statementsUntilDedent() {
		List<Stmt> statements = new ArrayList<>();
		while (!check(TokenKind.DEDENT) && !check(TokenKind.EOF)) {
			statementInto(statements);
		}
		if (check(TokenKind.DEDENT)) {
			advance();
		}
		return statements;
	}

	/**
	 * Statements of the block opened by {@code indent}. Past {@link #MAX_BLOCK_DEPTH} the block is
	 * reported once and skipped whole.
	 */
	private List<Stmt> indentedBlock(Token indent) {
		if (blockDepth >= MAX_BLOCK_DEPTH) {
			report(indent, "too many levels of indentation");
			skipBlock();
			return List.of();
		}
		blockDepth++;
		try {
			return statementsUntilDedent();
		} finally {
			blockDepth--;
		}
	}

	// consumes up to and including the DEDENT matching an already consumed INDENT
	private void skipBlock() {
		int open = 1;
		while (open > 0 && !check(TokenKind.EOF)) {
			if (check(TokenKind.INDENT)) {
				open++;
			} else if (check(TokenKind.DEDENT)) {
				open--;
			}
			advance();
		}
	}

	private Stmt statement() {
		switch (current.kind()) {
			case IF:
				return ifStatement();
			case WHILE:
				return whileStatement();
			case FOR:
				return forStatement();
			case DEF:
				return functionDef();
			case CLASS:
				return classDef();
			default:
				Stmt stmt = simpleStatement();
				endOfStatement();
				return stmt;
		}
	}

	private Stmt simpleStatement() {
		Token start = current;
		switch (start.kind()) {
			case RETURN: {
				advance();
				Expr value = atStatementEnd() ? null : expressionList();
				return new ReturnStmt(value, start.position());
			}
			case BREAK:
				advance();
				return new BreakStmt(start.position());
			case CONTINUE:
				advance();
				return new ContinueStmt(start.position());
			case PASS:
				advance();
				return new PassStmt(start.position());
			default:
				break;
		}

		if (start.kind().isAssignment()) {
			throw error(start, "assignment '" + start.kind().lexeme() + "' without a target");
		}

		Expr expr = expressionList();
		if (!current.kind().isAssignment() || !continues()) {
			return new ExprStmt(expr, start.position());
		}

		Token op = advance();
		checkTarget(expr, op);
		if (!continues()) {
			throw error(op, check(TokenKind.EOF)
					? "unexpected end of input, expected a value after '" + op.kind().lexeme() + "'"
					: "expected a value after '" + op.kind().lexeme() + "'");
		}
		Expr value = expressionList();
		return new AssignStmt(expr, ASSIGN_OPS.get(op.kind()), value, start.position());
	}

	private IfStmt ifStatement() {
		Token start = advance();
		Expr cond = condition(start);
		Block body = suite("if");

		List<ElifClause> elifs = new ArrayList<>();
		while (check(TokenKind.ELIF)) {
			Token elif = advance();
			Expr elifCond = condition(elif);
			elifs.add(new ElifClause(elifCond, suite("elif"), elif.position()));
		}

		Block orElse = null;
		if (check(TokenKind.ELSE)) {
			advance();
			orElse = suite("else");
		}
		return new IfStmt(cond, body, elifs, orElse, start.position());
	}

	private WhileStmt whileStatement() {
		Token start = advance();
		Expr cond = condition(start);
		return new WhileStmt(cond, suite("while"), start.position());
	}

	private ForStmt forStatement() {
		Token start = advance();
		Token name = expect(TokenKind.ID, "expected a loop variable after 'for'");
		expect(TokenKind.IN, "expected 'in' after the loop variable");
		Expr iterable = condition(previous);
		Identifier target = new Identifier(name.text(), name.position());
		return new ForStmt(target, iterable, suite("for"), start.position());
	}

	private FunctionDef functionDef() {
		Token start = advance();
		Token name = expect(TokenKind.ID, "expected a function name after 'def'");
		Token open = expect(TokenKind.LPAREN, "expected '(' after the function name");

		List<Parameter> params = new ArrayList<>();
		nesting++;
		try {
			Set<String> seen = new HashSet<>();
			boolean sawDefault = false;
			while (!check(TokenKind.RPAREN)) {
				Token param = expect(TokenKind.ID, "expected a parameter name");
				Expr defaultValue = null;
				if (match(TokenKind.ASSIGN)) {
					defaultValue = expression();
					sawDefault = true;
				} else if (sawDefault) {
					report(param, "non-default parameter '" + param.text() + "' follows a default parameter");
				}
				if (!seen.add(param.text())) {
					report(param, "duplicate parameter '" + param.text() + "'");
				}
				params.add(new Parameter(param.text(), defaultValue, param.position()));
				if (!match(TokenKind.COMMA)) {
					break;
				}
			}
			closing(TokenKind.RPAREN, open);
		} finally {
			nesting--;
		}

		return new FunctionDef(name.text(), params, suite("def"), start.position());
	}

	private ClassDef classDef() {
		Token start = advance();
		Token name = expect(TokenKind.ID, "expected a class name after 'class'");
		return new ClassDef(name.text(), suite("class"), start.position());
	}

	private Expr condition(Token keyword) {
		if (!continues() || check(TokenKind.COLON)) {
			throw error(check(TokenKind.EOF) || !continues() ? keyword : current,
					check(TokenKind.EOF)
							? "unexpected end of input after '" + keyword.text() + "'"
							: "expected an expression after '" + keyword.text() + "'");
		}
		return expression();
	}

	/**
	 * {@code ':'} followed by either one simple statement on the same line or an indented block.
	 */
	private Block suite(String construct) {
		if (!check(TokenKind.COLON)) {
			Token at = continues() ? current : previous;
			if (at == previous) {
				throw error(previous.endLine(), previous.column() + previous.text().length(),
						"expected ':' after " + construct + " header");
			}
			throw error(at, "expected ':' after " + construct + " header");
		}
		Token colon = advance();

		if (check(TokenKind.INDENT)) {
			Token indent = advance();
			List<Stmt> statements = indentedBlock(indent);
			SourcePosition pos = statements.isEmpty() ? indent.position() : statements.get(0).position();
			return new Block(statements, pos);
		}
		if (check(TokenKind.EOF)) {
			throw error(current, "unexpected end of input, expected an indented block");
		}
		if (continues()) {
			Stmt stmt = simpleStatement();
			endOfStatement();
			return new Block(List.of(stmt), stmt.position());
		}
		if (check(TokenKind.DEDENT)) {
			report(current, "expected an indented block");
		}
		// a next line at the same level has already been reported by the lexer
		return new Block(List.of(), colon.position());
	}

	private void endOfStatement() {
		if (!atStatementEnd()) {
			throw unexpected(current);
		}
	}

	private void checkTarget(Expr target, Token op) {
		boolean plain = op.is(TokenKind.ASSIGN);
		String invalid = invalidTarget(target, plain);
		if (invalid != null) {
			SourcePosition pos = target.position();
			throw error(pos.line(), pos.column(), plain
					? "cannot assign to " + invalid
					: "'" + op.kind().lexeme() + "' cannot assign to " + invalid);
		}
	}

	/**
	 * @return a description of what makes {@code target} unassignable, or null when it is fine
	 */
	private static String invalidTarget(Expr target, boolean allowUnpacking) {
		if (target instanceof Identifier || target instanceof AttributeExpr || target instanceof SubscriptExpr) {
			return null;
		}
		if (target instanceof TupleExpr tuple) {
			return allowUnpacking ? firstInvalid(tuple.elements()) : "tuple";
		}
		if (target instanceof ListExpr list) {
			return allowUnpacking ? firstInvalid(list.elements()) : "list";
		}
		if (target instanceof LiteralExpr) {
			return "literal";
		}
		if (target instanceof CallExpr) {
			return "function call";
		}
		if (target instanceof DictExpr) {
			return "dict literal";
		}
		if (target instanceof SetExpr) {
			return "set literal";
		}
		if (target instanceof ComparisonExpr) {
			return "comparison";
		}
		return "expression";
	}

	private static String firstInvalid(List<Expr> elements) {
		if (elements.isEmpty()) {
			return "empty tuple";
		}
		for (Expr e : elements) {
			String invalid = invalidTarget(e, true);
			if (invalid != null) {
				return invalid;
			}
		}
		return null;
	}

	// ---- expressions ----

	/**
	 * Comma separated expressions outside delimiters, e.g. {@code a, b = 1, 2}. A single expression
	 * is returned as is.
	 */
	private Expr expressionList() {
		Expr first = expression();
		if (!check(TokenKind.COMMA) || !continues()) {
			return first;
		}
		List<Expr> items = new ArrayList<>();
		items.add(first);
		while (check(TokenKind.COMMA) && continues()) {
			advance();
			if (atStatementEnd() || current.kind().isAssignment()) {
				break;
			}
			items.add(expression());
		}
		return new TupleExpr(items, first.position());
	}

	public Expr expression() {
		return nested(current, this::or);
	}

	private Expr or() {
		Expr left = and();
		while (check(TokenKind.OR) && continues()) {
			Token op = advance();
			Expr right = operand(op, this::and);
			left = new BinaryExpr(left, BinaryOp.OR, right, left.position());
		}
		return left;
	}

	private Expr and() {
		Expr left = not();
		while (check(TokenKind.AND) && continues()) {
			Token op = advance();
			Expr right = operand(op, this::not);
			left = new BinaryExpr(left, BinaryOp.AND, right, left.position());
		}
		return left;
	}

	private Expr not() {
		if (check(TokenKind.NOT)) {
			Token op = advance();
			Expr operand = nested(op, () -> operand(op, this::not));
			return new UnaryExpr(UnaryOp.NOT, operand, op.position());
		}
		return comparison();
	}

	private Expr comparison() {
		Expr left = additive();
		while (continues()) {
			ComparisonOp op = COMPARISON_OPS.get(current.kind());
			Token opToken;
			if (op != null) {
				opToken = advance();
			} else if (check(TokenKind.NOT)) {
				opToken = advance();
				expect(TokenKind.IN, "expected 'in' after 'not'");
				op = ComparisonOp.NOT_IN;
			} else {
				break;
			}
			Expr right = operand(opToken, this::additive);
			left = new ComparisonExpr(left, op, right, left.position());
		}
		return left;
	}

	private Expr additive() {
		Expr left = multiplicative();
		while ((check(TokenKind.PLUS) || check(TokenKind.MINUS)) && continues()) {
			Token op = advance();
			Expr right = operand(op, this::multiplicative);
			BinaryOp binary = op.is(TokenKind.PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
			left = new BinaryExpr(left, binary, right, left.position());
		}
		return left;
	}

	private Expr multiplicative() {
		Expr left = unary();
		while (continues()) {
			BinaryOp binary;
			switch (current.kind()) {
				case TIMES:
					binary = BinaryOp.MUL;
					break;
				case DIVIDE:
					binary = BinaryOp.DIV;
					break;
				case FLOOR_DIVIDE:
					binary = BinaryOp.FLOOR_DIV;
					break;
				case MOD:
					binary = BinaryOp.MOD;
					break;
				default:
					return left;
			}
			Token op = advance();
			Expr right = operand(op, this::unary);
			left = new BinaryExpr(left, binary, right, left.position());
		}
		return left;
	}

	private Expr unary() {
		if (check(TokenKind.PLUS) || check(TokenKind.MINUS)) {
			Token op = advance();
			Expr operand = nested(op, () -> operand(op, this::unary));
			UnaryOp unary = op.is(TokenKind.PLUS) ? UnaryOp.PLUS : UnaryOp.MINUS;
			return new UnaryExpr(unary, operand, op.position());
		}
		return power();
	}

	// right-associative: 2 ** 3 ** 2 == 2 ** (3 ** 2); the exponent may itself be signed
	private Expr power() {
		Expr base = postfix();
		if (check(TokenKind.POWER) && continues()) {
			Token op = advance();
			Expr exponent = nested(op, () -> operand(op, this::unary));
			return new BinaryExpr(base, BinaryOp.POW, exponent, base.position());
		}
		return base;
	}

	private Expr postfix() {
		Expr expr = primary();
		while (continues()) {
			if (check(TokenKind.LPAREN)) {
				expr = call(expr);
			} else if (check(TokenKind.LBRACKET)) {
				expr = subscript(expr);
			} else if (check(TokenKind.DOT)) {
				Token dot = advance();
				Token name = expect(TokenKind.ID, "expected an attribute name after '.'");
				expr = new AttributeExpr(expr, name.text(), dot.position());
			} else {
				break;
			}
		}
		return expr;
	}

	private Expr call(Expr callee) {
		Token open = advance();
		nesting++;
		try {
			List<Expr> args = new ArrayList<>();
			while (!check(TokenKind.RPAREN)) {
				args.add(expression());
				if (check(TokenKind.ASSIGN)) {
					throw error(current, "keyword arguments are not supported");
				}
				if (!match(TokenKind.COMMA)) {
					break;
				}
			}
			closing(TokenKind.RPAREN, open);
			return new CallExpr(callee, args, open.position());
		} finally {
			nesting--;
		}
	}

	private Expr subscript(Expr value) {
		Token open = advance();
		nesting++;
		try {
			Expr index = subscriptIndex(open);
			closing(TokenKind.RBRACKET, open);
			return new SubscriptExpr(value, index, open.position());
		} finally {
			nesting--;
		}
	}

	// expr | [lower] ':' [upper] [':' [step]]
	private Expr subscriptIndex(Token open) {
		if (check(TokenKind.RBRACKET)) {
			throw error(current, "expected an index or slice inside '[]'");
		}
		SourcePosition pos = current.position();
		Expr lower = null;
		if (!check(TokenKind.COLON)) {
			lower = expression();
			if (!check(TokenKind.COLON)) {
				return lower;
			}
		}
		advance();
		Expr upper = null;
		if (!check(TokenKind.COLON) && !check(TokenKind.RBRACKET)) {
			upper = expression();
		}
		Expr step = null;
		if (match(TokenKind.COLON) && !check(TokenKind.RBRACKET)) {
			step = expression();
		}
		return new SliceExpr(lower, upper, step, pos);
	}

	private Expr primary() {
		Token t = current;
		switch (t.kind()) {
			case NUMBER:
			case STRING:
				advance();
				return new LiteralExpr(t.value(), t.position());
			case TRUE:
				advance();
				return new LiteralExpr(Boolean.TRUE, t.position());
			case FALSE:
				advance();
				return new LiteralExpr(Boolean.FALSE, t.position());
			case NONE:
				advance();
				return new LiteralExpr(null, t.position());
			case ID:
				advance();
				return new Identifier(t.text(), t.position());
			case LPAREN:
				return parenthesized();
			case LBRACKET:
				return listDisplay();
			case LBRACE:
				return braceDisplay();
			default:
				throw unexpected(t);
		}
	}

	// () | (expr) | (expr,) | (expr, expr, ...)
	private Expr parenthesized() {
		Token open = advance();
		nesting++;
		try {
			if (match(TokenKind.RPAREN)) {
				return new TupleExpr(List.of(), open.position());
			}
			Expr first = expression();
			if (match(TokenKind.RPAREN)) {
				return first;
			}
			List<Expr> items = new ArrayList<>();
			items.add(first);
			while (match(TokenKind.COMMA)) {
				if (check(TokenKind.RPAREN)) {
					break;
				}
				items.add(expression());
			}
			closing(TokenKind.RPAREN, open);
			return new TupleExpr(items, open.position());
		} finally {
			nesting--;
		}
	}

	private Expr listDisplay() {
		Token open = advance();
		nesting++;
		try {
			List<Expr> items = new ArrayList<>();
			while (!check(TokenKind.RBRACKET)) {
				items.add(expression());
				if (!match(TokenKind.COMMA)) {
					break;
				}
			}
			closing(TokenKind.RBRACKET, open);
			return new ListExpr(items, open.position());
		} finally {
			nesting--;
		}
	}

	// {} is an empty dict; {k: v, ...} a dict; {a, b, ...} a set
	private Expr braceDisplay() {
		Token open = advance();
		nesting++;
		try {
			if (match(TokenKind.RBRACE)) {
				return new DictExpr(List.of(), open.position());
			}
			Expr first = expression();
			if (check(TokenKind.COLON)) {
				List<DictEntry> entries = new ArrayList<>();
				entries.add(dictEntry(first));
				while (match(TokenKind.COMMA)) {
					if (check(TokenKind.RBRACE)) {
						break;
					}
					entries.add(dictEntry(expression()));
				}
				closing(TokenKind.RBRACE, open);
				return new DictExpr(entries, open.position());
			}

			List<Expr> items = new ArrayList<>();
			items.add(first);
			while (match(TokenKind.COMMA)) {
				if (check(TokenKind.RBRACE)) {
					break;
				}
				items.add(expression());
			}
			closing(TokenKind.RBRACE, open);
			return new SetExpr(items, open.position());
		} finally {
			nesting--;
		}
	}

	private DictEntry dictEntry(Expr key) {
		expect(TokenKind.COLON, "expected ':' after dict key");
		Expr value = expression();
		return new DictEntry(key, value, key.position());
	}

	/**
	 * Right operand of {@code op}; reports a dangling operator when the expression stops here.
	 */
	private Expr operand(Token op, Supplier<Expr> next) {
		if (!continues()) {
			throw error(op, "incomplete expression: operator '" + op.kind().lexeme() + "' has no right operand");
		}
		return next.get();
	}

	/**
	 * Runs one level of expression recursion. Every path back into the grammar (brackets, prefix
	 * operators, exponents) goes through here, so the depth bounds the parser's stack use.
	 */
	private Expr nested(Token at, Supplier<Expr> body) {
		if (expressionDepth >= MAX_EXPRESSION_DEPTH) {
			throw error(at, "expression nested too deeply");
		}
		expressionDepth++;
		try {
			return body.get();
		} finally {
			expressionDepth--;
		}
	}

	// ---- token plumbing ----

	private Token advance() {
		previous = current;
		if (!current.is(TokenKind.EOF)) {
			current = lexer.nextToken();
		}
		return previous;
	}

	private boolean check(TokenKind kind) {
		return current.kind() == kind;
	}

	private boolean match(TokenKind kind) {
		if (check(kind)) {
			advance();
			return true;
		}
		return false;
	}

	private Token expect(TokenKind kind, String message) {
		if (check(kind)) {
			return advance();
		}
		if (check(TokenKind.EOF)) {
			throw error(current, "unexpected end of input, " + message);
		}
		throw error(current, message + ", found " + current.describe());
	}

	private Token closing(TokenKind kind, Token open) {
		if (check(kind)) {
			return advance();
		}
		String opened = "'" + open.kind().lexeme() + "' opened at line " + open.line();
		if (check(TokenKind.EOF)) {
			throw error(current, "unexpected end of input, " + opened + " is not closed");
		}
		String message = "expected '" + kind.lexeme() + "' to close " + opened;
		if (current.kind().isClosingDelimiter()) {
			message += ", found '" + current.kind().lexeme() + "'";
		}
		throw error(current, message);
	}

	/**
	 * Whether the current token may extend what came before it: true inside delimiters, otherwise
	 * only for a real token on the same line as the previous one.
	 */
	private boolean continues() {
		TokenKind kind = current.kind();
		if (kind == TokenKind.EOF || kind == TokenKind.INDENT || kind == TokenKind.DEDENT) {
			return false;
		}
		return nesting > 0 || previous == null || current.line() <= previous.endLine();
	}

	private boolean atStatementEnd() {
		return !continues();
	}

	/**
	 * Skips what is left of a broken statement: stops at a later line, a statement keyword, or an
	 * INDENT, DEDENT or end of input.
	 */
	private void synchronize(int errorLine) {
		int skipped = 0;
		while (!check(TokenKind.EOF) && !check(TokenKind.DEDENT) && !check(TokenKind.INDENT)
				&& current.line() <= errorLine && !STATEMENT_KEYWORDS.contains(current.kind())) {
			advance();
			skipped++;
		}
		log.debug("resynchronised at {} after skipping {} token(s)", current, skipped);
	}

	private SyntaxError unexpected(Token t) {
		return error(t, unexpectedMessage(t));
	}

	private String unexpectedMessage(Token t) {
		switch (t.kind()) {
			case EOF:
				return "unexpected end of input";
			case RPAREN:
			case RBRACKET:
			case RBRACE:
				return "unexpected closing delimiter '" + t.kind().lexeme() + "'";
			case COLON:
				return "unexpected ':' outside of an if/elif/else/while/for/def/class header";
			case COMMA:
				return nesting > 0
						? "expected an expression before ','"
						: "unexpected ',' outside of a list, tuple, set, dict or argument list";
			case ELSE:
			case ELIF:
				return "'" + t.kind().lexeme() + "' without a matching 'if'";
			case INDENT:
				return "unexpected indent";
			case DEDENT:
				return "unexpected dedent";
			default:
				return "unexpected " + t.describe();
		}
	}

	private void report(Token at, String message) {
		diagnostics.report(Stage.PARSER, message, at.line(), at.column());
	}

	private SyntaxError error(Token at, String message) {
		return error(at.line(), at.column(), message);
	}

	private SyntaxError error(int line, int column, String message) {
		diagnostics.report(Stage.PARSER, message, line, column);
		return new SyntaxError(line);
	}

	/**
	 * Unwinds a broken statement back to {@link #statementInto}. Never leaves the parser.
	 */
	private static final class SyntaxError extends RuntimeException {
		private final int line;

		SyntaxError(int line) {
			super(null, null, false, false);
			this.line = line;
		}
	}
}
