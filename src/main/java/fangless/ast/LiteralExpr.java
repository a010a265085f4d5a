package fangless.ast;

import java.math.BigInteger;

/**
 * Literal atom.
 *
 * The value is one of: {@link Long}, {@link BigInteger} (integers past long range), {@link Double},
 * {@link String}, {@link Boolean}, or null for {@code None}.
 */
public record LiteralExpr(Object value, SourcePosition position) implements Expr {
	public LiteralExpr {
		if (value != null && !(value instanceof Long || value instanceof BigInteger || value instanceof Double
				|| value instanceof String || value instanceof Boolean)) {
			throw new IllegalArgumentException("unsupported literal type: " + value.getClass().getName());
		}
	}

	public boolean isNone() {
		return value == null;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitLiteral(this);
	}
}
