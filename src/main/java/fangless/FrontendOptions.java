package fangless;

import fangless.parse.IndentationTracker;

/**
 * Knobs for one front-end run.
 *
 * @param tabWidth          columns a tab counts for, and the unit indentation must be a multiple of
 * @param strictIndentation also report an indent that jumps more than one level at once
 */
public record FrontendOptions(int tabWidth, boolean strictIndentation) {
	public FrontendOptions {
		if (tabWidth <= 0) {
			throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
		}
	}

	public static FrontendOptions defaults() {
		return new FrontendOptions(IndentationTracker.DEFAULT_TAB_WIDTH, false);
	}

	public FrontendOptions withTabWidth(int width) {
		return new FrontendOptions(width, strictIndentation);
	}

	public FrontendOptions withStrictIndentation(boolean strict) {
		return new FrontendOptions(tabWidth, strict);
	}
}
