package lrgen.parser.lr;

import java.util.List;
import java.util.OptionalInt;

import com.google.common.collect.ImmutableList;

import lrgen.grammar.Production;
import lrgen.grammar.Terminal;
import lrgen.lexer.Token;

/**
 * One step of the shift reduce parser: the configuration before and after it and the action taken.
 */
public class TraceStep {

	/**
	 * Starts at 1
	 */
	public final int number;
	public final SimulationState before;
	public final SimulationState after;
	/**
	 * Current input token when the step was taken
	 */
	public final Token token;
	public final LRParserTable.Action action;
	/**
	 * Applied production, null if this isn't a reduce step
	 */
	public final Production production;
	private final Integer gotoState;
	/**
	 * Terminals that were expected, only filled for error steps
	 */
	public final ImmutableList<Terminal> expected;
	/**
	 * Description of the problem, null if this isn't an error step
	 */
	public final String errorMessage;

	private TraceStep(SimulationState before, SimulationState after, Token token, LRParserTable.Action action,
	                  Production production, Integer gotoState, List<Terminal> expected, String errorMessage) {
		this.number = before.stepCount + 1;
		this.before = before;
		this.after = after;
		this.token = token;
		this.action = action;
		this.production = production;
		this.gotoState = gotoState;
		this.expected = ImmutableList.copyOf(expected);
		this.errorMessage = errorMessage;
	}

	static TraceStep shift(SimulationState before, SimulationState after, LRParserTable.ShiftAction action){
		return new TraceStep(before, after, before.currentToken(), action, null, null, ImmutableList.of(), null);
	}

	static TraceStep reduce(SimulationState before, SimulationState after, LRParserTable.ReduceAction action,
	                        int gotoState){
		return new TraceStep(before, after, before.currentToken(), action, action.production, gotoState,
				ImmutableList.of(), null);
	}

	static TraceStep accept(SimulationState before, SimulationState after, LRParserTable.Accept action){
		return new TraceStep(before, after, before.currentToken(), action, null, null, ImmutableList.of(), null);
	}

	static TraceStep error(SimulationState before, SimulationState after, List<Terminal> expected, String message){
		return new TraceStep(before, after, before.currentToken(), LRParserTable.ERROR, null, null, expected, message);
	}

	public boolean isShift(){
		return action instanceof LRParserTable.ShiftAction;
	}

	public boolean isReduce(){
		return action instanceof LRParserTable.ReduceAction;
	}

	public boolean isAccept(){
		return action instanceof LRParserTable.Accept;
	}

	public boolean isError(){
		return action instanceof LRParserTable.ErrorAction;
	}

	/**
	 * State pushed by the GOTO after a reduce
	 */
	public OptionalInt gotoState(){
		return gotoState == null ? OptionalInt.empty() : OptionalInt.of(gotoState);
	}

	/**
	 * Position of the current token in the input
	 */
	public int position(){
		return token.position;
	}

	public String describeAction(){
		if (isShift()){
			return "Shift " + ((LRParserTable.ShiftAction)action).stateToBeShifted;
		}
		if (isReduce()){
			return "Reduce " + production.id + ": " + production.toSimpleString();
		}
		if (isAccept()){
			return "Accept";
		}
		return "Error";
	}

	@Override
	public String toString() {
		return String.format("%3d | %-20s | %-20s | %20s | %s", number, before.formatStateStack(),
				before.formatSymbolStack(), before.formatRemainingInput(), describeAction());
	}
}
