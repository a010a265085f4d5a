package fangless.ast;

/**
 * Arithmetic and logical operators.
 */
public enum BinaryOp {
	ADD("+"),
	SUB("-"),
	MUL("*"),
	DIV("/"),
	FLOOR_DIV("//"),
	MOD("%"),
	POW("**"),
	AND("and"),
	OR("or");

	private final String symbol;

	BinaryOp(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
