package lrgen.parser.lr;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import lrgen.grammar.Production;

/**
 * Ordered steps of a single parser run. Immutable, a running {@link Simulation} creates a new trace
 * for every request.
 */
public class ParseTrace implements Iterable<TraceStep> {

	private final ImmutableList<TraceStep> steps;

	public ParseTrace(List<TraceStep> steps) {
		this.steps = ImmutableList.copyOf(steps);
	}

	public List<TraceStep> steps(){
		return steps;
	}

	public int size(){
		return steps.size();
	}

	public TraceStep get(int index){
		return steps.get(index);
	}

	public boolean isEmpty(){
		return steps.isEmpty();
	}

	public TraceStep lastStep(){
		if (steps.isEmpty()){
			throw new IllegalStateException("Empty trace");
		}
		return steps.get(steps.size() - 1);
	}

	public boolean isAccepted(){
		return !steps.isEmpty() && lastStep().isAccept();
	}

	public boolean isFailed(){
		return !steps.isEmpty() && lastStep().isError();
	}

	/**
	 * Applied productions in reduction order
	 */
	public List<Production> derivation(){
		ImmutableList.Builder<Production> builder = ImmutableList.builder();
		for (TraceStep step : steps) {
			if (step.isReduce()){
				builder.add(step.production);
			}
		}
		return builder.build();
	}

	/**
	 * Applied productions in the order of a rightmost derivation starting at the start symbol
	 */
	public List<Production> rightmostDerivation(){
		return Lists.reverse(derivation());
	}

	/**
	 * Descriptions of the actions, e.g. <code>Shift 3</code>
	 */
	public List<String> actionDescriptions(){
		ImmutableList.Builder<String> builder = ImmutableList.builder();
		for (TraceStep step : steps) {
			builder.add(step.describeAction());
		}
		return builder.build();
	}

	@Override
	public Iterator<TraceStep> iterator() {
		return steps.iterator();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder(String.format("%3s | %-20s | %-20s | %20s | %s", "#", "States",
				"Symbols", "Input", "Action"));
		for (TraceStep step : steps) {
			builder.append("\n").append(step);
		}
		return builder.toString();
	}
}
