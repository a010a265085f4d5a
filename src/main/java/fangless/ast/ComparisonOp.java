package fangless.ast;

public enum ComparisonOp {
	EQ("=="),
	NE("!="),
	LT("<"),
	LE("<="),
	GT(">"),
	GE(">="),
	IN("in"),
	NOT_IN("not in");

	private final String symbol;

	ComparisonOp(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
