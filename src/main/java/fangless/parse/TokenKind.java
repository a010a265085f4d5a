package fangless.parse;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kinds of tokens produced by {@link Lexer}.
 *
 * Kinds with a fixed spelling carry it as their lexeme; ID, NUMBER, STRING and the synthetic
 * INDENT/DEDENT have none.
 */
public enum TokenKind {
	// keywords
	IF("if", Category.KEYWORD),
	ELSE("else", Category.KEYWORD),
	ELIF("elif", Category.KEYWORD),
	WHILE("while", Category.KEYWORD),
	FOR("for", Category.KEYWORD),
	IN("in", Category.KEYWORD),
	BREAK("break", Category.KEYWORD),
	CONTINUE("continue", Category.KEYWORD),
	PASS("pass", Category.KEYWORD),
	DEF("def", Category.KEYWORD),
	RETURN("return", Category.KEYWORD),
	CLASS("class", Category.KEYWORD),
	TRUE("True", Category.KEYWORD),
	FALSE("False", Category.KEYWORD),
	NONE("None", Category.KEYWORD),
	AND("and", Category.KEYWORD),
	OR("or", Category.KEYWORD),
	NOT("not", Category.KEYWORD),

	ID(null, Category.LITERAL),
	NUMBER(null, Category.LITERAL),
	STRING(null, Category.LITERAL),

	// arithmetic
	PLUS("+", Category.OPERATOR),
	MINUS("-", Category.OPERATOR),
	TIMES("*", Category.OPERATOR),
	DIVIDE("/", Category.OPERATOR),
	FLOOR_DIVIDE("//", Category.OPERATOR),
	MOD("%", Category.OPERATOR),
	POWER("**", Category.OPERATOR),

	// relational
	EQUALS("==", Category.OPERATOR),
	NOT_EQUALS("!=", Category.OPERATOR),
	LESS_THAN("<", Category.OPERATOR),
	LESS_THAN_EQUALS("<=", Category.OPERATOR),
	GREATER_THAN(">", Category.OPERATOR),
	GREATER_THAN_EQUALS(">=", Category.OPERATOR),

	// assignment
	ASSIGN("=", Category.ASSIGNMENT),
	PLUS_ASSIGN("+=", Category.ASSIGNMENT),
	MINUS_ASSIGN("-=", Category.ASSIGNMENT),
	TIMES_ASSIGN("*=", Category.ASSIGNMENT),
	DIVIDE_ASSIGN("/=", Category.ASSIGNMENT),
	FLOOR_DIVIDE_ASSIGN("//=", Category.ASSIGNMENT),
	MOD_ASSIGN("%=", Category.ASSIGNMENT),
	POWER_ASSIGN("**=", Category.ASSIGNMENT),

	// delimiters
	LPAREN("(", Category.DELIMITER),
	RPAREN(")", Category.DELIMITER),
	LBRACKET("[", Category.DELIMITER),
	RBRACKET("]", Category.DELIMITER),
	LBRACE("{", Category.DELIMITER),
	RBRACE("}", Category.DELIMITER),
	COLON(":", Category.DELIMITER),
	COMMA(",", Category.DELIMITER),
	DOT(".", Category.DELIMITER),

	INDENT(null, Category.SYNTHETIC),
	DEDENT(null, Category.SYNTHETIC),
	EOF(null, Category.SYNTHETIC);

	private enum Category {
		KEYWORD, LITERAL, OPERATOR, ASSIGNMENT, DELIMITER, SYNTHETIC
	}

	private static final Map<String, TokenKind> KEYWORDS;

	static {
		Map<String, TokenKind> keywords = new HashMap<>();
		for (TokenKind kind : values()) {
			if (kind.category == Category.KEYWORD) {
				keywords.put(kind.lexeme, kind);
			}
		}
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final String lexeme;
	private final Category category;

	TokenKind(String lexeme, Category category) {
		this.lexeme = lexeme;
		this.category = category;
	}

	public String lexeme() {
		return lexeme;
	}

	public boolean isKeyword() {
		return category == Category.KEYWORD;
	}

	public boolean isAssignment() {
		return category == Category.ASSIGNMENT;
	}

	public boolean isOpeningDelimiter() {
		return this == LPAREN || this == LBRACKET || this == LBRACE;
	}

	public boolean isClosingDelimiter() {
		return this == RPAREN || this == RBRACKET || this == RBRACE;
	}

	/**
	 * Keyword kind for an exact, case-sensitive lexeme, or null when the word is an identifier.
	 */
	public static TokenKind keyword(String word) {
		return KEYWORDS.get(word);
	}
}
