package lrgen.grammar;

import java.util.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedSet;

import static lrgen.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions. Instances are immutable.
 *
 * Use the GrammarBuilder (or the GrammarParser for grammar texts) to build a grammar instance properly.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar {

	private final ImmutableSortedSet<NonTerminal> nonTerminals;

	/**
	 * Terminals of the grammar, always contains the end marker
	 */
	private final ImmutableSortedSet<Terminal> terminals;

	private final ImmutableList<Production> productions;

	private final ImmutableListMultimap<NonTerminal, Production> productionsPerNonTerminal;

	private final Map<String, Symbol> symbolsPerName = new HashMap<>();

	private final NonTerminal start;

	/**
	 * End of input terminal
	 */
	public final Terminal eof;

	/**
	 * <code>S' → S</code> if this grammar is augmented, else null
	 */
	private final Production augmentedProduction;

	private FirstSets firstSets;

	/**
	 * Create a new Grammar object
	 *
	 * @param terminals terminals used in the productions, including the end marker
	 * @param nonTerminals non terminals of the grammar
	 * @param start start non terminal
	 * @param productions productions, ordered by their ids
	 * @param eof end of input terminal
	 * @param augmentedProduction production of the augmented start symbol or null
	 * @throws UndefinedSymbolError if a non terminal has no productions
	 */
	Grammar(Collection<Terminal> terminals, Collection<NonTerminal> nonTerminals, NonTerminal start,
	        List<Production> productions, Terminal eof, Production augmentedProduction) {
		this.terminals = ImmutableSortedSet.copyOf(terminals);
		this.nonTerminals = ImmutableSortedSet.copyOf(nonTerminals);
		this.productions = ImmutableList.copyOf(productions);
		this.start = start;
		this.eof = eof;
		this.augmentedProduction = augmentedProduction;
		ImmutableListMultimap.Builder<NonTerminal, Production> builder = ImmutableListMultimap.builder();
		for (Production production : productions) {
			builder.put(production.left, production);
		}
		this.productionsPerNonTerminal = builder.build();
		for (Symbol symbol : this.terminals) {
			symbolsPerName.put(symbol.name, symbol);
		}
		for (Symbol symbol : this.nonTerminals) {
			symbolsPerName.put(symbol.name, symbol);
		}
		checkDefinedness();
	}

	private void checkDefinedness(){
		if (!productionsPerNonTerminal.containsKey(start)){
			throw new UndefinedSymbolError(start.name, String.format("Start symbol '%s' has no productions", start));
		}
		for (Production production : productions) {
			for (NonTerminal nonTerminal : production.nonTerminals) {
				if (!productionsPerNonTerminal.containsKey(nonTerminal)){
					throw new UndefinedSymbolError(nonTerminal.name,
							String.format("Symbol '%s' is used in production %s but has no productions",
									nonTerminal, production));
				}
			}
		}
	}

	public List<Production> getProductionOfNonTerminal(NonTerminal nonTerminal) {
		return productionsPerNonTerminal.get(nonTerminal);
	}

	/**
	 * Insert a new start non terminal with a <pre>A' → A</pre> rule (assuming <pre>A</pre> is the current
	 * start non terminal). The new production gets the id 0.
	 *
	 * @return new grammar, this grammar if it is already augmented
	 */
	public Grammar insertStartNonTerminal(){
		if (isAugmented()){
			return this;
		}
		int biggestId = 0;
		for (NonTerminal nonTerminal : nonTerminals) {
			biggestId = Math.max(nonTerminal.id, biggestId);
		}
		String startName = this.start.name + "'";
		while (symbolsPerName.containsKey(startName)) {
			startName += "'";
		}
		NonTerminal nonTerminal = new NonTerminal(biggestId + 1, startName);
		Production production = new Production(0, nonTerminal, Collections.singletonList(start));
		List<NonTerminal> newNonTerminals = new ArrayList<>(this.nonTerminals);
		newNonTerminals.add(nonTerminal);
		List<Production> newProductions = new ArrayList<>();
		newProductions.add(production);
		newProductions.addAll(this.productions);
		return new Grammar(terminals, newNonTerminals, nonTerminal, newProductions, eof, production);
	}

	public boolean isAugmented(){
		return augmentedProduction != null;
	}

	/**
	 * @return <code>S' → S</code>
	 * @throws IllegalStateException if the grammar isn't augmented
	 */
	public Production getAugmentedProduction(){
		if (!isAugmented()){
			throw new IllegalStateException("Grammar isn't augmented");
		}
		return augmentedProduction;
	}

	/**
	 * The start symbol of the grammar before it was augmented
	 */
	public NonTerminal getOriginalStart(){
		return isAugmented() ? (NonTerminal)augmentedProduction.right.get(0) : start;
	}

	public NonTerminal getStart(){
		return start;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Production getProduction(int id){
		for (Production production : productions) {
			if (production.id == id){
				return production;
			}
		}
		throw new NoSuchElementException("No production with id " + id);
	}

	public Set<Terminal> getTerminals(){
		return terminals;
	}

	public Set<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	public Optional<Terminal> getTerminal(String name){
		Symbol symbol = symbolsPerName.get(name);
		return symbol instanceof Terminal ? Optional.of((Terminal)symbol) : Optional.empty();
	}

	public Optional<NonTerminal> getNonTerminal(String name){
		Symbol symbol = symbolsPerName.get(name);
		return symbol instanceof NonTerminal ? Optional.of((NonTerminal)symbol) : Optional.empty();
	}

	/**
	 * FIRST sets of this grammar, calculated on first use
	 */
	public FirstSets firstSets(){
		if (firstSets == null){
			firstSets = FirstSets.calculate(this);
		}
		return firstSets;
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}
