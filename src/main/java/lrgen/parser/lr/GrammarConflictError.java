package lrgen.parser.lr;

import lrgen.LRException;
import lrgen.grammar.Terminal;

/**
 * Two different actions for the same cell of the ACTION table. The grammar isn't LR(1), conflicts are never
 * resolved implicitly.
 */
public class GrammarConflictError extends LRException {

	public final ItemSet state;
	public final Terminal terminal;
	/**
	 * Action that was already in the table cell
	 */
	public final LRParserTable.Action existing;
	public final LRParserTable.Action competing;

	public GrammarConflictError(ItemSet state, Terminal terminal, LRParserTable.Action existing,
	                            LRParserTable.Action competing) {
		super(String.format("%s conflict in state %d at terminal %s: %s vs %s%n%s",
				kind(existing, competing), state.id, terminal, existing, competing, state));
		this.state = state;
		this.terminal = terminal;
		this.existing = existing;
		this.competing = competing;
	}

	public int stateId(){
		return state.id;
	}

	public boolean isShiftReduce(){
		return (existing instanceof LRParserTable.ShiftAction) != (competing instanceof LRParserTable.ShiftAction);
	}

	public boolean isReduceReduce(){
		return existing instanceof LRParserTable.ReduceAction && competing instanceof LRParserTable.ReduceAction;
	}

	private static String kind(LRParserTable.Action existing, LRParserTable.Action competing){
		if (existing instanceof LRParserTable.ReduceAction && competing instanceof LRParserTable.ReduceAction){
			return "Reduce-reduce";
		}
		if (existing instanceof LRParserTable.ShiftAction || competing instanceof LRParserTable.ShiftAction){
			return "Shift-reduce";
		}
		return "Accept-reduce";
	}
}
