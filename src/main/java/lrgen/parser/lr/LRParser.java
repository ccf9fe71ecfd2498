package lrgen.parser.lr;

import java.util.List;

import lrgen.Config;
import lrgen.lexer.Token;

/**
 * Parses a whole input at once.
 *
 * The number of steps is bounded by <code>maxSteps + (states + 1) · tokens</code>, the bound grows with the
 * input as the number of reductions between two shifts is limited for a table without conflicts.
 */
public class LRParser {

	private final ShiftReduceSimulator simulator;
	private final int maxSteps;
	private final int stepsPerToken;

	/**
	 * @param maxSteps base number of steps allowed independent of the input length
	 */
	public LRParser(LRParserTable table, int maxSteps) {
		this.simulator = new ShiftReduceSimulator(table);
		this.maxSteps = maxSteps;
		this.stepsPerToken = table.stateCount() + 1;
	}

	public LRParser(LRParserTable table) {
		this(table, Config.maxSteps());
	}

	/**
	 * @return trace of the accepted input
	 * @throws ParseError if the input isn't part of the language
	 */
	public ParseTrace parse(String input){
		return parse(simulator.initial(input));
	}

	public ParseTrace parse(List<Token> tokens){
		return parse(simulator.initial(tokens));
	}

	private ParseTrace parse(SimulationState initial){
		return new Simulation(simulator, initial).run(stepLimit(initial.input().size()));
	}

	int stepLimit(int tokens){
		return (int)Math.min(Integer.MAX_VALUE, maxSteps + (long)stepsPerToken * tokens);
	}

	public boolean accepts(String input){
		try {
			return parse(input).isAccepted();
		} catch (ParseError error){
			return false;
		}
	}
}
