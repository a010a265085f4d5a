package fangless.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * All mutable indentation bookkeeping of one lexer, in one place.
 *
 * Invariants: the stack is strictly increasing from bottom to top and its bottom is always 0;
 * {@code delimiterDepth} never goes below 0; pending tokens are handed out before any new
 * character is scanned.
 */
public final class IndentationState {
	final Deque<Integer> stack = new ArrayDeque<>();
	final Deque<Token> pending = new ArrayDeque<>();
	boolean expectIndent;
	int delimiterDepth;
	boolean atLineStart = true;

	public IndentationState() {
		stack.push(0);
	}

	public int currentLevel() {
		return stack.peek();
	}

	/**
	 * Indentation widths from the base (0) to the innermost level.
	 */
	public List<Integer> levels() {
		List<Integer> levels = new ArrayList<>(stack);
		Collections.reverse(levels);
		return levels;
	}

	public int depth() {
		return stack.size() - 1;
	}

	public boolean expectsIndent() {
		return expectIndent;
	}

	public int delimiterDepth() {
		return delimiterDepth;
	}

	public boolean hasPending() {
		return !pending.isEmpty();
	}

	Token nextPending() {
		return pending.poll();
	}
}
