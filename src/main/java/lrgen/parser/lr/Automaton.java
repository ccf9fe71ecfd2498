package lrgen.parser.lr;

import java.util.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;

import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.model.*;

import lrgen.grammar.*;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.attribute.Rank.RankDir.LEFT_TO_RIGHT;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * The canonical LR(1) automaton of a grammar: states (item sets) and the goto function between them.
 *
 * Immutable, build it with {@link #createFromGrammar(Grammar)} or the {@link AutomatonBuilder}.
 */
public class Automaton {

	public static final String START_STATE_COLOR = "#d1fae5";
	public static final String ACCEPTING_STATE_COLOR = "#fef3c7";
	public static final String STATE_COLOR = "#dbeafe";

	public final Grammar grammar;

	private final ImmutableList<ItemSet> states;

	private final ImmutableSortedSet<Transition> transitions;

	private final ImmutableTable<Integer, Symbol, Integer> gotoFunction;

	Automaton(Grammar grammar, List<ItemSet> states, Collection<Transition> transitions) {
		this.grammar = grammar;
		this.states = ImmutableList.copyOf(states);
		this.transitions = ImmutableSortedSet.copyOf(transitions);
		ImmutableTable.Builder<Integer, Symbol, Integer> builder = ImmutableTable.builder();
		for (Transition transition : transitions) {
			builder.put(transition.from, transition.symbol, transition.to);
		}
		this.gotoFunction = builder.build();
	}

	public static Automaton createFromGrammar(Grammar grammar){
		return new AutomatonBuilder(grammar).build();
	}

	/**
	 * States ordered by their ids, the state with the id i is at index i
	 */
	public List<ItemSet> states(){
		return states;
	}

	public ItemSet getState(int id){
		return states.get(id);
	}

	public ItemSet startState(){
		return states.get(0);
	}

	public int size(){
		return states.size();
	}

	/**
	 * Edges of the automaton ordered by source state and symbol
	 */
	public SortedSet<Transition> transitions(){
		return transitions;
	}

	public OptionalInt target(int state, Symbol symbol){
		Integer target = gotoFunction.get(state, symbol);
		return target == null ? OptionalInt.empty() : OptionalInt.of(target);
	}

	/**
	 * Does the state contain the item <code>[S' → S ·, $]</code>?
	 */
	public boolean isAccepting(ItemSet state){
		return state.contains(new LR1Item(grammar.getAugmentedProduction(), 1, grammar.eof));
	}

	public LRParserTable toParserTable(){
		return LRParserTable.fromAutomaton(this);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (ItemSet state : states){
			if (state.id != 0){
				builder.append("\n–––––––\n");
			}
			builder.append(state.toString());
		}
		return builder.toString();
	}

	/**
	 * Graphviz model of the automaton, the states are labeled with all their items. Edges over non
	 * terminals are dashed.
	 */
	public Graph toDotGraph(){
		List<MutableNode> nodes = new ArrayList<>();
		for (ItemSet state : states) {
			MutableNode node = mutNode("I" + state.id);
			node.add(Label.html(state.toHTMLString()));
			String color = STATE_COLOR;
			if (state.id == 0){
				color = START_STATE_COLOR;
				node.add(attr("penwidth", 3));
			} else if (isAccepting(state)){
				color = ACCEPTING_STATE_COLOR;
				node.add(attr("penwidth", 2));
			}
			node.add(attr("fillcolor", color));
			nodes.add(node);
		}
		for (Transition transition : transitions) {
			Link link = to(nodes.get(transition.to)).with(Label.of(transition.symbol.name));
			if (transition.symbol.isNonTerminal()){
				link = link.with(Style.DASHED);
			}
			nodes.get(transition.from).addLink(link);
		}
		return graph("lr1").directed()
				.graphAttr().with(Rank.dir(LEFT_TO_RIGHT))
				.nodeAttr().with(Shape.BOX, attr("style", "rounded,filled"), Font.name("Courier"))
				.linkAttr().with(Font.name("Courier"))
				.with(nodes.toArray(new MutableNode[0]));
	}

	public String toDotString(){
		return toDotGraph().toString();
	}
}
