package lrgen.parser.lr;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableSortedSet;

import lrgen.grammar.*;

/**
 * Builds the canonical collection of LR(1) item sets of a grammar.
 */
public class AutomatonBuilder {

	private static final Logger LOG = Logger.getLogger("lrgen.automaton");

	/**
	 * Order in which discovered states are processed. The resulting automaton is the same for both orders
	 * (up to the numbering of the states).
	 */
	public enum WorklistOrder {
		FIFO, LIFO
	}

	private final Grammar grammar;
	private final FirstSets firstSets;

	/**
	 * @param grammar grammar, augmented if it isn't already
	 */
	public AutomatonBuilder(Grammar grammar) {
		this.grammar = grammar.insertStartNonTerminal();
		this.firstSets = this.grammar.firstSets();
	}

	public Grammar getGrammar() {
		return grammar;
	}

	/**
	 * Closure of an item set: adds <code>[B → · γ, b]</code> for every item <code>[A → α · B β, a]</code>, every
	 * production <code>B → γ</code> and every <code>b ∈ FIRST(β a)</code> until no new item is added.
	 */
	public SortedSet<LR1Item> closure(Collection<LR1Item> items){
		Set<LR1Item> closure = new HashSet<>(items);
		Deque<LR1Item> worklist = new ArrayDeque<>(items);
		while (!worklist.isEmpty()){
			LR1Item item = worklist.poll();
			if (!item.inFrontOfNonTerminal()){
				continue;
			}
			NonTerminal nonTerminal = (NonTerminal)item.nextSymbol();
			Set<Terminal> lookaheads = firstSets.first(item.restAfterNextSymbol(), item.lookahead);
			for (Production production : grammar.getProductionOfNonTerminal(nonTerminal)) {
				for (Terminal lookahead : lookaheads) {
					LR1Item newItem = new LR1Item(production, 0, lookahead);
					if (closure.add(newItem)){
						worklist.add(newItem);
					}
				}
			}
		}
		return ImmutableSortedSet.copyOf(closure);
	}

	/**
	 * Advances the dot over the passed symbol in all items that allow it and returns the closure of the
	 * advanced items.
	 *
	 * @return empty set if no item has the symbol after its dot
	 */
	public SortedSet<LR1Item> goTo(Collection<LR1Item> items, Symbol symbol){
		List<LR1Item> advanced = new ArrayList<>();
		for (LR1Item item : items) {
			if (item.inFrontOf(symbol)){
				advanced.add(item.advance());
			}
		}
		if (advanced.isEmpty()){
			return ImmutableSortedSet.of();
		}
		return closure(advanced);
	}

	public LR1Item startItem(){
		return new LR1Item(grammar.getAugmentedProduction(), 0, grammar.eof);
	}

	public Automaton build(){
		return build(WorklistOrder.FIFO);
	}

	/**
	 * Builds the canonical collection. State 0 is the closure of the start item, every new goto target
	 * gets the next free id.
	 */
	public Automaton build(WorklistOrder order){
		Map<Set<LR1Item>, ItemSet> knownStates = new HashMap<>();
		List<ItemSet> states = new ArrayList<>();
		List<Transition> transitions = new ArrayList<>();
		Deque<ItemSet> worklist = new ArrayDeque<>();
		ItemSet startState = new ItemSet(0, closure(Collections.singletonList(startItem())));
		states.add(startState);
		knownStates.put(startState.items(), startState);
		worklist.add(startState);
		while (!worklist.isEmpty()){
			ItemSet current = order == WorklistOrder.FIFO ? worklist.pollFirst() : worklist.pollLast();
			for (Symbol symbol : current.symbolsAfterDot()) {
				SortedSet<LR1Item> targetItems = goTo(current.items(), symbol);
				ItemSet target = knownStates.get(targetItems);
				if (target == null){
					target = new ItemSet(states.size(), targetItems);
					states.add(target);
					knownStates.put(target.items(), target);
					worklist.add(target);
				}
				transitions.add(new Transition(current.id, symbol, target.id));
			}
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Built LR(1) automaton with %d states and %d transitions",
					states.size(), transitions.size()));
		}
		return new Automaton(grammar, states, transitions);
	}
}
