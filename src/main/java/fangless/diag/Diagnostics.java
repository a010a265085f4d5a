package fangless.diag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only diagnostic list shared by the lexer and the parser of one parse.
 */
public final class Diagnostics {
	private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

	private final List<Diagnostic> entries = new ArrayList<>();
	private final String source;

	public Diagnostics(String source) {
		this.source = source;
	}

	public Diagnostic report(Stage stage, String message, int line, int column) {
		Diagnostic d = new Diagnostic(message, line, column, stage, source);
		entries.add(d);
		log.debug("{}", d);
		return d;
	}

	public List<Diagnostic> all() {
		return List.copyOf(entries);
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public boolean hasErrors() {
		return !entries.isEmpty();
	}

	public boolean hasErrorsFrom(Stage stage) {
		return entries.stream().anyMatch(d -> d.stage() == stage);
	}
}
