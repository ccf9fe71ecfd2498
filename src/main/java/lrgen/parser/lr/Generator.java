package lrgen.parser.lr;

import java.util.logging.Level;
import java.util.logging.Logger;

import lrgen.grammar.FirstSets;
import lrgen.grammar.Grammar;
import lrgen.grammar.GrammarParser;

/**
 * Result of the whole pipeline for one grammar: grammar, FIRST sets, automaton and table.
 */
public class Generator {

	private static final Logger LOG = Logger.getLogger("lrgen.generator");

	public final Grammar grammar;
	public final FirstSets firstSets;
	public final Automaton automaton;
	public final LRParserTable table;
	private final ShiftReduceSimulator simulator;

	private Generator(Grammar grammar, FirstSets firstSets, Automaton automaton, LRParserTable table) {
		this.grammar = grammar;
		this.firstSets = firstSets;
		this.automaton = automaton;
		this.table = table;
		this.simulator = new ShiftReduceSimulator(table);
	}

	public static Generator fromGrammar(Grammar grammar){
		Grammar augmented = grammar.insertStartNonTerminal();
		FirstSets firstSets = augmented.firstSets();
		Automaton automaton = new AutomatonBuilder(augmented).build();
		LRParserTable table = automaton.toParserTable();
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Generated parser for %d productions with %d states",
					augmented.getProductions().size(), automaton.size()));
		}
		return new Generator(augmented, firstSets, automaton, table);
	}

	public static Generator fromText(String grammarText){
		return fromGrammar(GrammarParser.parseGrammar(grammarText));
	}

	public ShiftReduceSimulator simulator(){
		return simulator;
	}

	/**
	 * @return fresh simulation of the input, nothing is executed yet
	 */
	public Simulation newSimulation(String input){
		return simulator.newSimulation(input);
	}

	/**
	 * @throws ParseError if the input isn't accepted
	 */
	public ParseTrace parse(String input){
		return new LRParser(table).parse(input);
	}

	public boolean accepts(String input){
		return new LRParser(table).accepts(input);
	}
}
