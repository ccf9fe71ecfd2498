package lrgen;

import lrgen.lexer.Location;
import lrgen.lexer.Token;

/**
 * An error that can be pinned to a place in the grammar text or the parsed input.
 */
public class LocatedLRException extends LRException {

	/**
	 * Offending token, null for errors in grammar texts
	 */
	public final Token errorToken;
	public final Location errorLocation;

	public LocatedLRException(Token errorToken, String message) {
		super(message);
		this.errorToken = errorToken;
		if (errorToken != null) {
			this.errorLocation = errorToken.location;
		} else {
			this.errorLocation = new Location(0, 0);
		}
	}

	public LocatedLRException(Location location, String message) {
		super(message);
		this.errorToken = null;
		this.errorLocation = location;
	}
}
