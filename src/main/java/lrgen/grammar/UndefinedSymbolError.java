package lrgen.grammar;

import lrgen.LRException;

/**
 * A non terminal is used (on a right hand side or as the start symbol) but never defined.
 */
public class UndefinedSymbolError extends LRException {

	public final String symbol;

	public UndefinedSymbolError(String symbol, String message) {
		super(message);
		this.symbol = symbol;
	}

	public UndefinedSymbolError(String symbol) {
		this(symbol, String.format("Symbol '%s' is used but has no productions", symbol));
	}
}
