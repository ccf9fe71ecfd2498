package lrgen.grammar;

/**
 * A terminal symbol, the terminal with id 0 is the end of input marker.
 */
public class Terminal extends Symbol {

	public static final int END_MARKER_ID = 0;

	public Terminal(int id, String name) {
		super(id, name);
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	public boolean isEndMarker(){
		return id == END_MARKER_ID;
	}
}
