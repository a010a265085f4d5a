package fangless.symbol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Insert-only map from identifier name to its first declaration.
 *
 * Later declarations of the same name are ignored: the first one wins.
 */
public final class SymbolTable {
	private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	/**
	 * @return true if the name was new, false if it was already declared
	 */
	public boolean declare(String name, int line, int column, String kind) {
		if (symbols.containsKey(name)) {
			log.trace("'{}' already declared, keeping first declaration at line {}", name, symbols.get(name).line());
			return false;
		}
		symbols.put(name, new Symbol(name, line, column, kind));
		return true;
	}

	public boolean contains(String name) {
		return symbols.containsKey(name);
	}

	public Optional<Symbol> lookup(String name) {
		return Optional.ofNullable(symbols.get(name));
	}

	public Collection<Symbol> symbols() {
		return Collections.unmodifiableCollection(symbols.values());
	}

	public int size() {
		return symbols.size();
	}
}
