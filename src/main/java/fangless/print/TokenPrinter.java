package fangless.print;

import fangless.parse.Token;

import java.util.List;

public final class TokenPrinter {
	public String print(List<Token> tokens) {
		StringBuilder out = new StringBuilder();
		String nl = System.lineSeparator();
		for (Token t : tokens) {
			out.append(t.kind());
			if (!t.text().isEmpty()) {
				out.append(' ').append(t.text());
			}
			out.append(" @").append(t.line()).append(':').append(t.column()).append(nl);
		}
		return out.toString();
	}
}
