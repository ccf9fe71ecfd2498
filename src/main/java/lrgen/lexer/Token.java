package lrgen.lexer;

/**
 * A single input token, its text is the name of a terminal.
 */
public class Token {

	/**
	 * Position of the token in the token sequence, starting at 0.
	 * The end marker token has the position <code>number of real tokens</code>.
	 */
	public final int position;

	/**
	 * Matched text.
	 */
	public final String value;

	public final Location location;

	/**
	 * Is this the synthetic end of input token?
	 */
	public final boolean endMarker;

	public Token(int position, String value, Location location, boolean endMarker){
		this.position = position;
		this.value = value;
		this.location = location;
		this.endMarker = endMarker;
	}

	public Token(int position, String value, Location location){
		this(position, value, location, false);
	}

	@Override
	public String toString() {
		return value + location.toString();
	}

	public String toSimpleString(){
		return value;
	}
}
