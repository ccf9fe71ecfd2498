package lrgen.grammar;

import lrgen.LocatedLRException;
import lrgen.lexer.Location;

/**
 * A malformed line in a grammar text or a malformed production passed to the grammar builder.
 */
public class GrammarSyntaxError extends LocatedLRException {

	/**
	 * Line of the grammar text (starting at 1), 0 if the production didn't come from a text
	 */
	public final int line;

	public GrammarSyntaxError(int line, String message) {
		super(new Location(line, 1), line > 0 ? String.format("Error in line %d: %s", line, message) : message);
		this.line = line;
	}
}
