package lrgen.parser.lr;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import lrgen.grammar.*;

/**
 * ACTION and GOTO table of an LR(1) parser. Immutable, created from an automaton via
 * {@link #fromAutomaton(Automaton)}.
 */
public class LRParserTable {

	private static final Logger LOG = Logger.getLogger("lrgen.table");

	public final Grammar grammar;

	/**
	 * Mapping of terminal to actions for each state (missing cells are errors).
	 */
	private final ImmutableList<ImmutableSortedMap<Terminal, Action>> actionTable;

	/**
	 * Mapping of non terminal to next state (for each state).
	 */
	private final ImmutableList<ImmutableSortedMap<NonTerminal, Integer>> gotoTable;

	private LRParserTable(Grammar grammar, List<ImmutableSortedMap<Terminal, Action>> actionTable,
	                      List<ImmutableSortedMap<NonTerminal, Integer>> gotoTable) {
		this.grammar = grammar;
		this.actionTable = ImmutableList.copyOf(actionTable);
		this.gotoTable = ImmutableList.copyOf(gotoTable);
	}

	public static abstract class Action {

		public abstract String name();
	}

	public static class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "shift(" + stateToBeShifted + ")";
		}

		@Override
		public String name() {
			return "shift";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ShiftAction && ((ShiftAction)obj).stateToBeShifted == stateToBeShifted;
		}

		@Override
		public int hashCode() {
			return stateToBeShifted;
		}
	}

	public static class ReduceAction extends Action {

		public final Production production;

		public ReduceAction(Production production) {
			this.production = production;
		}

		@Override
		public String toString() {
			return "reduce(" + production + ")";
		}

		@Override
		public String name() {
			return "reduce";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ReduceAction && ((ReduceAction)obj).production.equals(production);
		}

		@Override
		public int hashCode() {
			return -production.id - 1;
		}
	}

	public static class Accept extends Action {

		@Override
		public String toString() {
			return "accept()";
		}

		@Override
		public String name() {
			return "accept";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Accept;
		}

		@Override
		public int hashCode() {
			return Integer.MAX_VALUE;
		}
	}

	public static class ErrorAction extends Action {

		@Override
		public String toString() {
			return "error()";
		}

		@Override
		public String name() {
			return "error";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ErrorAction;
		}

		@Override
		public int hashCode() {
			return Integer.MIN_VALUE;
		}
	}

	/**
	 * Action of every cell that isn't set
	 */
	public static final Action ERROR = new ErrorAction();

	/**
	 * Collects the entries of a table, fails on the first conflicting entry.
	 */
	private static class Builder {

		private final Automaton automaton;
		private final List<SortedMap<Terminal, Action>> actionTable = new ArrayList<>();
		private final List<SortedMap<NonTerminal, Integer>> gotoTable = new ArrayList<>();

		Builder(Automaton automaton) {
			this.automaton = automaton;
			for (int i = 0; i < automaton.size(); i++) {
				actionTable.add(new TreeMap<>());
				gotoTable.add(new TreeMap<>());
			}
		}

		private void insert(ItemSet state, Terminal terminal, Action action){
			SortedMap<Terminal, Action> row = actionTable.get(state.id);
			Action cur = row.get(terminal);
			if (cur != null && !cur.equals(action)){
				throw new GrammarConflictError(state, terminal, cur, action);
			}
			row.put(terminal, action);
		}

		void addShift(ItemSet state, Terminal terminal, int newState){
			insert(state, terminal, new ShiftAction(newState));
		}

		void addReduce(ItemSet state, Terminal terminal, Production production){
			insert(state, terminal, new ReduceAction(production));
		}

		void addAccept(ItemSet state, Terminal terminal){
			insert(state, terminal, new Accept());
		}

		void addGoto(ItemSet state, NonTerminal nonTerminal, int newState){
			gotoTable.get(state.id).put(nonTerminal, newState);
		}

		LRParserTable build(){
			List<ImmutableSortedMap<Terminal, Action>> actions = new ArrayList<>();
			for (SortedMap<Terminal, Action> row : actionTable) {
				actions.add(ImmutableSortedMap.copyOfSorted(row));
			}
			List<ImmutableSortedMap<NonTerminal, Integer>> gotos = new ArrayList<>();
			for (SortedMap<NonTerminal, Integer> row : gotoTable) {
				gotos.add(ImmutableSortedMap.copyOfSorted(row));
			}
			return new LRParserTable(automaton.grammar, actions, gotos);
		}
	}

	/**
	 * Derives the ACTION and GOTO table from the automaton.
	 *
	 * @throws GrammarConflictError if a cell would get two different actions
	 */
	public static LRParserTable fromAutomaton(Automaton automaton){
		Grammar grammar = automaton.grammar;
		Builder builder = new Builder(automaton);
		for (ItemSet state : automaton.states()) {
			for (LR1Item item : state) {
				if (item.inFrontOfTerminal()){
					Terminal terminal = (Terminal)item.nextSymbol();
					builder.addShift(state, terminal, automaton.target(state.id, terminal).getAsInt());
				} else if (item.isComplete()){
					if (item.left().equals(grammar.getStart())){
						if (item.lookahead.equals(grammar.eof)){
							builder.addAccept(state, grammar.eof);
						}
					} else {
						builder.addReduce(state, item.lookahead, item.production);
					}
				}
			}
		}
		for (Transition transition : automaton.transitions()) {
			if (transition.symbol instanceof NonTerminal){
				builder.addGoto(automaton.getState(transition.from), (NonTerminal)transition.symbol, transition.to);
			}
		}
		LRParserTable table = builder.build();
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Built parser table with %d states, %d ACTION and %d GOTO entries",
					table.stateCount(), table.actionEntries().values().stream().mapToInt(Map::size).sum(),
					table.gotoEntries().values().stream().mapToInt(Map::size).sum()));
		}
		return table;
	}

	public int stateCount(){
		return actionTable.size();
	}

	/**
	 * @return action of the cell, {@link #ERROR} if it is not set
	 */
	public Action action(int state, Terminal terminal){
		Action action = actionTable.get(state).get(terminal);
		return action == null ? ERROR : action;
	}

	public OptionalInt gotoState(int state, NonTerminal nonTerminal){
		Integer target = gotoTable.get(state).get(nonTerminal);
		return target == null ? OptionalInt.empty() : OptionalInt.of(target);
	}

	/**
	 * Terminals with a non error action in the passed state
	 */
	public SortedSet<Terminal> expectedTerminals(int state){
		return actionTable.get(state).keySet();
	}

	/**
	 * Non error ACTION cells per state
	 */
	public Map<Integer, SortedMap<Terminal, Action>> actionEntries(){
		ImmutableMap.Builder<Integer, SortedMap<Terminal, Action>> builder = ImmutableMap.builder();
		for (int i = 0; i < actionTable.size(); i++) {
			builder.put(i, actionTable.get(i));
		}
		return builder.build();
	}

	/**
	 * Defined GOTO cells per state
	 */
	public Map<Integer, SortedMap<NonTerminal, Integer>> gotoEntries(){
		ImmutableMap.Builder<Integer, SortedMap<NonTerminal, Integer>> builder = ImmutableMap.builder();
		for (int i = 0; i < gotoTable.size(); i++) {
			builder.put(i, gotoTable.get(i));
		}
		return builder.build();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < actionTable.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(String.format("State = %5d: ", i));
			builder.append(" Actions = [");
			boolean first = true;
			for (Map.Entry<Terminal, Action> entry : actionTable.get(i).entrySet()) {
				if (!first){
					builder.append(", ");
				}
				first = false;
				builder.append(entry.getKey()).append(" = ").append(entry.getValue());
			}
			builder.append("] GOTO = ");
			builder.append(gotoTable.get(i));
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LRParserTable && ((LRParserTable)obj).actionTable.equals(actionTable)
				&& ((LRParserTable)obj).gotoTable.equals(gotoTable);
	}

	@Override
	public int hashCode() {
		return actionTable.hashCode() * 31 + gotoTable.hashCode();
	}
}
