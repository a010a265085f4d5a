package fangless.ast;

public enum AssignOp {
	ASSIGN("="),
	ADD_ASSIGN("+="),
	SUB_ASSIGN("-="),
	MUL_ASSIGN("*="),
	DIV_ASSIGN("/="),
	FLOOR_DIV_ASSIGN("//="),
	MOD_ASSIGN("%="),
	POW_ASSIGN("**=");

	private final String symbol;

	AssignOp(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
