package lrgen.parser.lr;

import java.util.List;

import com.google.common.collect.ImmutableList;

import lrgen.grammar.Symbol;
import lrgen.lexer.Token;
import lrgen.util.Utils;

/**
 * Immutable configuration of the shift reduce parser: state stack, symbol stack and the position in the input.
 *
 * The symbol stack is one element shorter than the state stack, the bottom state has no symbol.
 */
public class SimulationState {

	public enum Status {
		RUNNING, ACCEPTED, FAILED
	}

	private final LinkedStack<Integer> stateStack;
	private final LinkedStack<Symbol> symbolStack;
	/**
	 * Input tokens, the last one is the end marker
	 */
	private final ImmutableList<Token> input;
	/**
	 * Index of the current input token
	 */
	public final int cursor;
	public final Status status;
	/**
	 * Number of steps that lead to this configuration
	 */
	public final int stepCount;

	private SimulationState(LinkedStack<Integer> stateStack, LinkedStack<Symbol> symbolStack,
	                        ImmutableList<Token> input, int cursor, Status status, int stepCount) {
		this.stateStack = stateStack;
		this.symbolStack = symbolStack;
		this.input = input;
		this.cursor = cursor;
		this.status = status;
		this.stepCount = stepCount;
	}

	/**
	 * @param startState id of the start state of the automaton
	 * @param input tokens ending with the end marker token
	 */
	public static SimulationState initial(int startState, List<Token> input){
		if (input.isEmpty() || !input.get(input.size() - 1).endMarker){
			throw new IllegalArgumentException("The input has to end with the end marker token");
		}
		return new SimulationState(LinkedStack.<Integer>empty().push(startState), LinkedStack.empty(),
				ImmutableList.copyOf(input), 0, Status.RUNNING, 0);
	}

	/**
	 * States from bottom to top, created on every call
	 */
	public List<Integer> stateStack(){
		return stateStack.toList();
	}

	/**
	 * Symbols from bottom to top, created on every call
	 */
	public List<Symbol> symbolStack(){
		return symbolStack.toList();
	}

	public int stackSize(){
		return stateStack.size();
	}

	public List<Token> input(){
		return input;
	}

	public int currentState(){
		return stateStack.peek();
	}

	public Token currentToken(){
		return input.get(cursor);
	}

	public List<Token> remainingInput(){
		return input.subList(cursor, input.size());
	}

	public boolean isFinished(){
		return status != Status.RUNNING;
	}

	public boolean isAccepted(){
		return status == Status.ACCEPTED;
	}

	SimulationState shift(int state, Symbol symbol){
		return new SimulationState(stateStack.push(state), symbolStack.push(symbol), input, cursor + 1, status,
				stepCount + 1);
	}

	/**
	 * Pops the passed number of states and symbols, without counting a step
	 */
	SimulationState pop(int count){
		return new SimulationState(stateStack.pop(count), symbolStack.pop(count), input, cursor, status, stepCount);
	}

	SimulationState push(int state, Symbol symbol){
		return new SimulationState(stateStack.push(state), symbolStack.push(symbol), input, cursor, status,
				stepCount + 1);
	}

	SimulationState finish(Status status){
		return new SimulationState(stateStack, symbolStack, input, cursor, status, stepCount + 1);
	}

	public String formatStateStack(){
		return Utils.join(stateStack.toList(), " ");
	}

	public String formatSymbolStack(){
		return Utils.join(symbolStack.toList(), " ");
	}

	public String formatRemainingInput(){
		StringBuilder builder = new StringBuilder();
		for (Token token : remainingInput()) {
			if (builder.length() > 0){
				builder.append(" ");
			}
			builder.append(token.toSimpleString());
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return String.format("[%s] [%s] [%s] %s", formatStateStack(), formatSymbolStack(), formatRemainingInput(),
				status);
	}
}
