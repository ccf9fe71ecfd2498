package lrgen.grammar.random;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import lrgen.LRException;
import lrgen.grammar.Grammar;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;

/**
 * A generator of random sentences that are valid for a given grammar.
 *
 * Productions are chosen with a weight of <code>factor^length</code>, the factor shrinks with the depth of the
 * derivation. Beyond the maximum depth the production with the lowest derivation height is used, so every
 * generation terminates.
 */
public class SentenceGenerator {

	public static final int DEFAULT_MAX_DEPTH = 10;
	public static final double DEFAULT_FACTOR = 0.8;

	private final Grammar grammar;
	private final Random rand;
	private final int maxDepth;
	/**
	 * Minimal height of a derivation tree for each productive non terminal
	 */
	private final Map<NonTerminal, Integer> heights;

	public SentenceGenerator(Grammar grammar, Random rand, int maxDepth) {
		this.grammar = grammar;
		this.rand = rand;
		this.maxDepth = maxDepth;
		this.heights = calculateHeights(grammar);
		if (!heights.containsKey(grammar.getOriginalStart())){
			throw new LRException(String.format("The start symbol %s derives no terminal sequence",
					grammar.getOriginalStart()));
		}
	}

	public SentenceGenerator(Grammar grammar, long seed) {
		this(grammar, new Random(seed), DEFAULT_MAX_DEPTH);
	}

	public SentenceGenerator(Grammar grammar) {
		this(grammar, new Random(), DEFAULT_MAX_DEPTH);
	}

	private static Map<NonTerminal, Integer> calculateHeights(Grammar grammar){
		Map<NonTerminal, Integer> heights = new HashMap<>();
		boolean changed = true;
		while (changed){
			changed = false;
			for (Production production : grammar.getProductions()) {
				int height = height(heights, production);
				if (height != -1 && height < heights.getOrDefault(production.left, Integer.MAX_VALUE)){
					heights.put(production.left, height);
					changed = true;
				}
			}
		}
		return heights;
	}

	/**
	 * @return -1 if a non terminal of the right side isn't known to be productive yet
	 */
	private static int height(Map<NonTerminal, Integer> heights, Production production){
		int height = 1;
		for (NonTerminal nonTerminal : production.nonTerminals) {
			if (!heights.containsKey(nonTerminal)){
				return -1;
			}
			height = Math.max(height, heights.get(nonTerminal) + 1);
		}
		return height;
	}

	/**
	 * @return random sentence derived from the (original) start symbol
	 */
	public List<Terminal> generateRandomSentence(){
		List<Terminal> terminals = new ArrayList<>();
		generate(grammar.getOriginalStart(), 0, DEFAULT_FACTOR, terminals);
		return terminals;
	}

	public String generateRandomSentenceString(){
		StringBuilder builder = new StringBuilder();
		for (Terminal terminal : generateRandomSentence()) {
			if (builder.length() > 0){
				builder.append(" ");
			}
			builder.append(terminal.name);
		}
		return builder.toString();
	}

	private void generate(NonTerminal nonTerminal, int depth, double factor, List<Terminal> terminals){
		Production production = depth >= maxDepth ? lowestProduction(nonTerminal)
				: weightedProduction(factor, usableProductions(nonTerminal));
		for (Symbol symbol : production.right) {
			if (symbol instanceof NonTerminal){
				generate((NonTerminal)symbol, depth + 1, factor * DEFAULT_FACTOR, terminals);
			} else {
				terminals.add((Terminal)symbol);
			}
		}
	}

	private List<Production> usableProductions(NonTerminal nonTerminal){
		List<Production> productions = new ArrayList<>();
		for (Production production : grammar.getProductionOfNonTerminal(nonTerminal)) {
			if (height(heights, production) != -1){
				productions.add(production);
			}
		}
		return productions;
	}

	private Production lowestProduction(NonTerminal nonTerminal){
		Production ret = null;
		int min = Integer.MAX_VALUE;
		for (Production production : usableProductions(nonTerminal)) {
			int height = height(heights, production);
			if (height < min){
				min = height;
				ret = production;
			}
		}
		return ret;
	}

	private Production weightedProduction(double factor, List<Production> avProds){
		double sum = 0;
		for (Production avProd : avProds) {
			sum += Math.pow(factor, avProd.rightSize());
		}
		double randomNum = rand.nextDouble() * sum;
		Production ret = avProds.get(avProds.size() - 1);
		sum = 0;
		for (Production avProd : avProds) {
			sum += Math.pow(factor, avProd.rightSize());
			if (randomNum <= sum){
				ret = avProd;
				break;
			}
		}
		return ret;
	}
}
