package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import com.google.common.collect.ImmutableList;

import lrgen.grammar.Grammar;
import lrgen.grammar.Production;
import lrgen.grammar.Terminal;
import lrgen.lexer.Location;
import lrgen.lexer.Token;
import lrgen.lexer.WhitespaceLexer;

/**
 * Shift reduce parser driven by an {@link LRParserTable}. Holds no state of a run, the caller passes the
 * current configuration to {@link #step(SimulationState)} and gets the next one back.
 */
public class ShiftReduceSimulator {

	public final LRParserTable table;
	private final Grammar grammar;
	private final WhitespaceLexer lexer;

	public ShiftReduceSimulator(LRParserTable table) {
		this.table = table;
		this.grammar = table.grammar;
		this.lexer = new WhitespaceLexer(grammar.eof.name);
	}

	/**
	 * @param input whitespace separated terminal names
	 */
	public SimulationState initial(String input){
		return initial(lexer.tokenize(input));
	}

	/**
	 * @param tokens input tokens, the end marker token is appended if missing
	 */
	public SimulationState initial(List<Token> tokens){
		if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).endMarker){
			List<Token> withEnd = new ArrayList<>(tokens);
			Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
			withEnd.add(new Token(tokens.size(), grammar.eof.name,
					last == null ? new Location(1, 1) : last.location, true));
			tokens = withEnd;
		}
		return SimulationState.initial(0, tokens);
	}

	public Simulation newSimulation(String input){
		return new Simulation(this, initial(input));
	}

	public Simulation newSimulation(List<Token> tokens){
		return new Simulation(this, initial(tokens));
	}

	/**
	 * Executes the action of the table for the top state and the current token. An error cell, an unknown
	 * token or a missing GOTO entry produce an error step with a failed configuration.
	 *
	 * @throws IllegalStateException if the configuration is already accepted or failed
	 */
	public TraceStep step(SimulationState state){
		if (state.isFinished()){
			throw new IllegalStateException("Parser already finished with " + state.status);
		}
		Token token = state.currentToken();
		int top = state.currentState();
		Optional<Terminal> terminal = terminalOf(token);
		if (!terminal.isPresent()){
			return TraceStep.error(state, state.finish(SimulationState.Status.FAILED),
					ImmutableList.copyOf(table.expectedTerminals(top)),
					String.format("Unknown token '%s'", token.value));
		}
		LRParserTable.Action action = table.action(top, terminal.get());
		if (action instanceof LRParserTable.ShiftAction){
			LRParserTable.ShiftAction shift = (LRParserTable.ShiftAction)action;
			return TraceStep.shift(state, state.shift(shift.stateToBeShifted, terminal.get()), shift);
		}
		if (action instanceof LRParserTable.ReduceAction){
			LRParserTable.ReduceAction reduce = (LRParserTable.ReduceAction)action;
			Production production = reduce.production;
			SimulationState popped = state.pop(production.rightSize());
			OptionalInt target = table.gotoState(popped.currentState(), production.left);
			if (!target.isPresent()){
				return TraceStep.error(state, state.finish(SimulationState.Status.FAILED), ImmutableList.of(),
						String.format("No GOTO entry for state %d and %s after reducing %s",
								popped.currentState(), production.left, production.toSimpleString()));
			}
			return TraceStep.reduce(state, popped.push(target.getAsInt(), production.left), reduce,
					target.getAsInt());
		}
		if (action instanceof LRParserTable.Accept){
			return TraceStep.accept(state, state.finish(SimulationState.Status.ACCEPTED),
					(LRParserTable.Accept)action);
		}
		return TraceStep.error(state, state.finish(SimulationState.Status.FAILED),
				ImmutableList.copyOf(table.expectedTerminals(top)),
				String.format("Unexpected '%s'", token.value));
	}

	private Optional<Terminal> terminalOf(Token token){
		if (token.endMarker){
			return Optional.of(grammar.eof);
		}
		Optional<Terminal> terminal = grammar.getTerminal(token.value);
		if (terminal.isPresent() && terminal.get().isEndMarker()){
			return Optional.empty();
		}
		return terminal;
	}
}
