package lrgen.grammar;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;

/**
 * FIRST(1) sets and nullability of all symbols of a grammar.
 *
 * Calculated by a fix point iteration: all sets start empty and every pass over the productions adds
 * <code>FIRST(X_i)</code> to <code>FIRST(A)</code> for each production <code>A → X_1 … X_n</code> as long as
 * <code>X_1 … X_{i-1}</code> are nullable. The sets only grow and are bounded by the set of terminals, so the
 * iteration terminates.
 */
public class FirstSets {

	private static final Logger LOG = Logger.getLogger("lrgen.grammar");

	private final Grammar grammar;

	private final ImmutableMap<NonTerminal, ImmutableSortedSet<Terminal>> firstSets;

	private final ImmutableSet<NonTerminal> nullable;

	/**
	 * Number of passes over the productions, including the last one that didn't change anything
	 */
	private final int iterations;

	private FirstSets(Grammar grammar, Map<NonTerminal, ? extends Set<Terminal>> firstSets,
	                  Set<NonTerminal> nullable, int iterations) {
		this.grammar = grammar;
		ImmutableMap.Builder<NonTerminal, ImmutableSortedSet<Terminal>> builder = ImmutableMap.builder();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			builder.put(nonTerminal, ImmutableSortedSet.copyOf(firstSets.get(nonTerminal)));
		}
		this.firstSets = builder.build();
		this.nullable = ImmutableSet.copyOf(nullable);
		this.iterations = iterations;
	}

	public static FirstSets calculate(Grammar grammar){
		Map<NonTerminal, TreeSet<Terminal>> first = new HashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			first.put(nonTerminal, new TreeSet<>());
		}
		Set<NonTerminal> nullable = new HashSet<>();
		int iterations = 0;
		boolean somethingChanged;
		do {
			somethingChanged = pass(grammar, first, nullable);
			iterations++;
		} while (somethingChanged);
		FirstSets firstSets = new FirstSets(grammar, first, nullable, iterations);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Calculated FIRST sets in %d iterations: %s", iterations, firstSets));
		}
		return firstSets;
	}

	/**
	 * One pass over all productions.
	 *
	 * @return true if a set changed
	 */
	private static boolean pass(Grammar grammar, Map<NonTerminal, ? extends Set<Terminal>> first,
	                            Set<NonTerminal> nullable){
		boolean somethingChanged = false;
		for (Production production : grammar.getProductions()) {
			Set<Terminal> leftSet = first.get(production.left);
			boolean allNullable = true;
			for (Symbol symbol : production.right) {
				if (symbol instanceof Terminal){
					somethingChanged = leftSet.add((Terminal)symbol) || somethingChanged;
					allNullable = false;
					break;
				}
				somethingChanged = leftSet.addAll(first.get(symbol)) || somethingChanged;
				if (!nullable.contains(symbol)){
					allNullable = false;
					break;
				}
			}
			if (allNullable){
				somethingChanged = nullable.add(production.left) || somethingChanged;
			}
		}
		return somethingChanged;
	}

	/**
	 * Runs another pass of the fix point iteration on copies of the calculated sets.
	 *
	 * @return true if the pass doesn't change anything
	 */
	public boolean isFixedPoint(){
		Map<NonTerminal, TreeSet<Terminal>> first = new HashMap<>();
		for (Map.Entry<NonTerminal, ImmutableSortedSet<Terminal>> entry : firstSets.entrySet()) {
			first.put(entry.getKey(), new TreeSet<>(entry.getValue()));
		}
		return !pass(grammar, first, new HashSet<>(nullable));
	}

	/**
	 * FIRST set of a single symbol, the FIRST set of a terminal is the terminal itself
	 */
	public Set<Terminal> first(Symbol symbol){
		if (symbol instanceof Terminal){
			return ImmutableSortedSet.of((Terminal)symbol);
		}
		ImmutableSortedSet<Terminal> set = firstSets.get(symbol);
		if (set == null){
			throw new IllegalArgumentException(String.format("Unknown symbol %s", symbol));
		}
		return set;
	}

	/**
	 * Terminals that can begin a string derived from the passed symbol sequence
	 */
	public Set<Terminal> first(List<? extends Symbol> term){
		TreeSet<Terminal> set = new TreeSet<>();
		for (Symbol symbol : term) {
			set.addAll(first(symbol));
			if (!isNullable(symbol)){
				break;
			}
		}
		return set;
	}

	/**
	 * <code>FIRST(term lookahead)</code>: like {@link #first(List)} but contains the lookahead if the whole
	 * term can derive the empty word
	 */
	public Set<Terminal> first(List<? extends Symbol> term, Terminal lookahead){
		Set<Terminal> set = first(term);
		if (isNullable(term)){
			set.add(lookahead);
		}
		return set;
	}

	public boolean isNullable(Symbol symbol){
		return symbol instanceof NonTerminal && nullable.contains(symbol);
	}

	public boolean isNullable(List<? extends Symbol> term){
		for (Symbol symbol : term) {
			if (!isNullable(symbol)){
				return false;
			}
		}
		return true;
	}

	public Set<NonTerminal> nullableNonTerminals(){
		return nullable;
	}

	public int iterations(){
		return iterations;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append("FIRST(").append(nonTerminal).append(") = ").append(firstSets.get(nonTerminal));
			if (nullable.contains(nonTerminal)){
				builder.append(" ∪ {").append(Production.EPSILON).append("}");
			}
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FirstSets && ((FirstSets)obj).firstSets.equals(firstSets)
				&& ((FirstSets)obj).nullable.equals(nullable);
	}

	@Override
	public int hashCode() {
		return firstSets.hashCode();
	}
}
