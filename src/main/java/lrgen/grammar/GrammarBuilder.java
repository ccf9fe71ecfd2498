package lrgen.grammar;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import lrgen.Config;

/**
 * Allows the simple creation of grammars.
 *
 * Symbols are plain strings: every symbol that is the left hand side of a production is a non terminal, all
 * others are terminals. If terminals are declared via {@link #terminals(String...)}, a right hand side symbol
 * that is neither a declared terminal nor a defined non terminal is an error.
 */
public class GrammarBuilder {

	private static final Logger LOG = Logger.getLogger("lrgen.grammar");

	private static class RawProduction {
		final int line;
		final String left;
		final List<String> right;

		RawProduction(int line, String left, List<String> right) {
			this.line = line;
			this.left = left;
			this.right = right;
		}

		boolean sameRule(RawProduction other){
			return left.equals(other.left) && right.equals(other.right);
		}
	}

	private final String endMarker;
	private final Set<String> epsilonMarkers;
	private final List<RawProduction> productions = new ArrayList<>();
	private final Set<String> usedNonTerminals = new LinkedHashSet<>();
	private Set<String> declaredTerminals = null;

	public GrammarBuilder(String endMarker, Set<String> epsilonMarkers) {
		this.endMarker = endMarker;
		this.epsilonMarkers = new HashSet<>(epsilonMarkers);
	}

	public GrammarBuilder() {
		this(Config.endMarker(), Config.epsilonMarkers());
	}

	/**
	 * Declares the terminals of the grammar and enables the check for undefined symbols.
	 */
	public GrammarBuilder terminals(String... terminals){
		if (declaredTerminals == null){
			declaredTerminals = new LinkedHashSet<>();
		}
		for (String terminal : terminals) {
			checkSymbolName(0, terminal);
			declaredTerminals.add(terminal);
		}
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are symbol names, an empty string or an epsilon marker stands
	 * for ε and is dropped.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, String... right){
		return add(0, left, Arrays.asList(right));
	}

	/**
	 * Adds a new production that originates from the passed line of a grammar text.
	 *
	 * @throws GrammarSyntaxError if the left hand side is empty or a reserved symbol is used
	 */
	public GrammarBuilder add(int line, String left, List<String> right){
		if (left == null || left.trim().isEmpty()){
			throw new GrammarSyntaxError(line, "Empty left hand side");
		}
		left = left.trim();
		checkSymbolName(line, left);
		if (epsilonMarkers.contains(left)){
			throw new GrammarSyntaxError(line, String.format("'%s' denotes the empty word and can't be defined", left));
		}
		List<String> symbols = new ArrayList<>();
		for (String symbol : right) {
			if (symbol.isEmpty() || epsilonMarkers.contains(symbol)){
				continue;
			}
			checkSymbolName(line, symbol);
			symbols.add(symbol);
		}
		RawProduction production = new RawProduction(line, left, symbols);
		for (RawProduction other : productions) {
			if (other.sameRule(production)){
				LOG.fine(() -> String.format("Dropped duplicate production %s → %s", other.left, other.right));
				return this;
			}
		}
		usedNonTerminals.add(left);
		productions.add(production);
		return this;
	}

	private void checkSymbolName(int line, String symbol){
		if (symbol.equals(endMarker)){
			throw new GrammarSyntaxError(line, String.format("'%s' is the reserved end marker", symbol));
		}
		for (char c : symbol.toCharArray()) {
			if (Character.isWhitespace(c)){
				throw new GrammarSyntaxError(line, String.format("Symbol '%s' contains whitespace", symbol));
			}
		}
	}

	/**
	 * Creates the augmented grammar, the left hand side of the first production is the start symbol.
	 */
	public Grammar toGrammar(){
		if (productions.isEmpty()){
			throw new GrammarSyntaxError(0, "Grammar has no productions");
		}
		return toGrammar(productions.get(0).left);
	}

	/**
	 * Creates the augmented grammar with the passed start symbol.
	 *
	 * @throws UndefinedSymbolError if the start symbol or a used non terminal has no productions
	 */
	public Grammar toGrammar(String startNonTerminal) {
		if (productions.isEmpty()){
			throw new GrammarSyntaxError(0, "Grammar has no productions");
		}
		if (declaredTerminals != null){
			for (String nonTerminal : usedNonTerminals) {
				if (declaredTerminals.contains(nonTerminal)){
					throw new GrammarSyntaxError(lineOf(nonTerminal),
							String.format("'%s' is declared as a terminal and therefore can't be used as a non terminal name",
							nonTerminal));
				}
			}
		}
		Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
		Map<String, Terminal> terminals = new LinkedHashMap<>();
		Terminal eof = new Terminal(Terminal.END_MARKER_ID, endMarker);
		terminals.put(endMarker, eof);
		for (String nonTerminal : usedNonTerminals) {
			nonTerminals.put(nonTerminal, new NonTerminal(nonTerminals.size(), nonTerminal));
		}
		if (declaredTerminals != null){
			for (String terminal : declaredTerminals) {
				terminals.put(terminal, new Terminal(terminals.size(), terminal));
			}
		}
		if (!nonTerminals.containsKey(startNonTerminal)){
			if (terminals.containsKey(startNonTerminal) || usedOnRightSide(startNonTerminal)){
				throw new GrammarSyntaxError(0, String.format("Start symbol '%s' is a terminal", startNonTerminal));
			}
			throw new UndefinedSymbolError(startNonTerminal,
					String.format("Start symbol '%s' has no productions", startNonTerminal));
		}
		List<Production> productions = new ArrayList<>();
		for (RawProduction raw : this.productions) {
			List<Symbol> right = new ArrayList<>();
			for (String name : raw.right) {
				if (nonTerminals.containsKey(name)){
					right.add(nonTerminals.get(name));
				} else if (terminals.containsKey(name)){
					right.add(terminals.get(name));
				} else if (declaredTerminals != null){
					throw new UndefinedSymbolError(name, String.format("Error in line %d: symbol '%s' is neither a " +
							"declared terminal nor defined by a production", raw.line, name));
				} else {
					Terminal terminal = new Terminal(terminals.size(), name);
					terminals.put(name, terminal);
					right.add(terminal);
				}
			}
			productions.add(new Production(productions.size() + 1, nonTerminals.get(raw.left), right));
		}
		Grammar grammar = new Grammar(terminals.values(), nonTerminals.values(),
				nonTerminals.get(startNonTerminal), productions, eof, null).insertStartNonTerminal();
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("Built grammar\n" + grammar.longDescription());
		}
		return grammar;
	}

	private boolean usedOnRightSide(String symbol){
		for (RawProduction production : productions) {
			if (production.right.contains(symbol)){
				return true;
			}
		}
		return false;
	}

	private int lineOf(String nonTerminal){
		for (RawProduction production : productions) {
			if (production.left.equals(nonTerminal)){
				return production.line;
			}
		}
		return 0;
	}
}
