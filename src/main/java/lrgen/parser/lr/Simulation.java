package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.List;

import lrgen.LRException;

/**
 * Context of a single parser run, owned by the caller. It drives the {@link ShiftReduceSimulator} one step
 * at a time and collects the trace.
 */
public class Simulation {

	private final ShiftReduceSimulator simulator;
	private SimulationState state;
	private final List<TraceStep> steps = new ArrayList<>();

	public Simulation(ShiftReduceSimulator simulator, SimulationState initial) {
		this.simulator = simulator;
		this.state = initial;
	}

	/**
	 * Executes the next step.
	 *
	 * @throws ParseError if the step fails, the failing step is part of the trace
	 * @throws IllegalStateException if the run is already finished
	 */
	public TraceStep step(){
		TraceStep step = simulator.step(state);
		steps.add(step);
		state = step.after;
		if (step.isError()){
			throw new ParseError(step, trace());
		}
		return step;
	}

	/**
	 * Steps until the input is accepted or an error occurs.
	 */
	public ParseTrace run(){
		return run(Integer.MAX_VALUE);
	}

	/**
	 * @throws LRException if the run needs more than <code>maxSteps</code> steps
	 */
	public ParseTrace run(int maxSteps){
		while (!isFinished()){
			if (steps.size() >= maxSteps){
				throw new LRException(String.format("Parsing didn't finish after %d steps", maxSteps));
			}
			step();
		}
		return trace();
	}

	public ParseTrace trace(){
		return new ParseTrace(steps);
	}

	public SimulationState state(){
		return state;
	}

	public boolean isFinished(){
		return state.isFinished();
	}

	public boolean isAccepted(){
		return state.isAccepted();
	}
}
