package lrgen.grammar;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Symbols are identified by their kind and their id, ids are assigned by the grammar builder and are unique
 * per kind inside a grammar.
 */
public abstract class Symbol implements Comparable<Symbol> {

	public final int id;

	public final String name;

	protected Symbol(int id, String name) {
		this.id = id;
		this.name = name;
	}

	public abstract boolean isTerminal();

	public boolean isNonTerminal(){
		return !isTerminal();
	}

	@Override
	public int hashCode() {
		if (isTerminal()){
			return -id - 1;
		}
		return id + 1;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).id == id
				&& ((Symbol)obj).name.equals(name);
	}

	/**
	 * Terminals come before non terminals, symbols of the same kind are ordered by their ids.
	 */
	@Override
	public int compareTo(Symbol o) {
		if (isTerminal() != o.isTerminal()){
			return isTerminal() ? -1 : 1;
		}
		return Integer.compare(id, o.id);
	}

	@Override
	public String toString() {
		return name;
	}
}
