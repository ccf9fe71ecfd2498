package lrgen.grammar;

/**
 * A non terminal symbol. Its productions are stored in the grammar.
 */
public class NonTerminal extends Symbol {

	public NonTerminal(int id, String name) {
		super(id, name);
	}

	@Override
	public boolean isTerminal() {
		return false;
	}
}
