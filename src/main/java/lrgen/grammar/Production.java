package lrgen.grammar;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Comparable<Production> {

	/**
	 * Marker used when printing an empty right hand side
	 */
	public static final String EPSILON = "ε";

	/**
	 * Id of the production, 0 is reserved for the production of the augmented start symbol
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for epsilon productions
	 */
	public final ImmutableList<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final ImmutableList<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final ImmutableList<Terminal> terminals;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = left;
		this.right = ImmutableList.copyOf(right);
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : right) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else {
				terminals.add((Terminal)symbol);
			}
		}
		this.nonTerminals = ImmutableList.copyOf(nonTerminals);
		this.terminals = ImmutableList.copyOf(terminals);
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return EPSILON;
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	/**
	 * @return "A → α" without the id
	 */
	public String toSimpleString(){
		return left + " → " + formatRightSide();
	}

	@Override
	public String toString() {
		return id + ": " + toSimpleString();
	}

	/**
	 * Does this production have an empty right hand side?
	 */
	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return other.id == id && other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return id * 31 + left.hashCode();
	}

	@Override
	public int compareTo(Production o) {
		return Integer.compare(id, o.id);
	}
}
