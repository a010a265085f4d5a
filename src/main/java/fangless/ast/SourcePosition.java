package fangless.ast;

/**
 * Source position for diagnostics and AST nodes.
 *
 * Lines and columns are 1-based. {@link #NONE} marks a node without a known position.
 */
public record SourcePosition(int line, int column) {
	public static final SourcePosition NONE = new SourcePosition(-1, -1);

	public boolean isPresent() {
		return line > 0;
	}
}
