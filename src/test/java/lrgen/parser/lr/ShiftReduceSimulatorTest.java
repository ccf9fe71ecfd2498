package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import lrgen.LRException;
import lrgen.grammar.Production;
import lrgen.lexer.Location;
import lrgen.lexer.Token;

import static org.junit.jupiter.api.Assertions.*;

public class ShiftReduceSimulatorTest {

	static final String AB = "S -> A B\nA -> a\nB -> b";

	static final String PARENS = "S -> ( S ) S | ε";

	private static ShiftReduceSimulator simulator(String grammar){
		return Generator.fromText(grammar).simulator();
	}

	private static List<String> derivation(ParseTrace trace){
		return trace.derivation().stream().map(Production::toSimpleString).collect(Collectors.toList());
	}

	@Test
	public void testScenario(){
		ParseTrace trace = simulator(AB).newSimulation("a b").run();
		assertEquals(Arrays.asList("Shift 1", "Reduce 2: A → a", "Shift 4", "Reduce 3: B → b",
				"Reduce 1: S → A B", "Accept"), trace.actionDescriptions());
		assertEquals(Arrays.asList("A → a", "B → b", "S → A B"), derivation(trace));
		assertEquals(Arrays.asList("S → A B", "B → b", "A → a"), trace.rightmostDerivation().stream()
				.map(Production::toSimpleString).collect(Collectors.toList()));
		assertTrue(trace.isAccepted());
		assertFalse(trace.isFailed());
	}

	@Test
	public void testStepRecords(){
		ParseTrace trace = simulator(AB).newSimulation("a b").run();
		TraceStep first = trace.get(0);
		assertEquals(1, first.number);
		assertTrue(first.isShift());
		assertEquals("a", first.token.value);
		assertEquals(0, first.position());
		assertEquals(Arrays.asList(0), first.before.stateStack());
		assertEquals(Arrays.asList(0, 1), first.after.stateStack());
		assertEquals("a", first.after.formatSymbolStack());
		assertEquals("b $", first.after.formatRemainingInput());
		assertNull(first.production);
		assertFalse(first.gotoState().isPresent());

		TraceStep reduce = trace.get(1);
		assertTrue(reduce.isReduce());
		assertEquals("A → a", reduce.production.toSimpleString());
		assertEquals(3, reduce.gotoState().getAsInt());
		assertEquals(Arrays.asList(0, 3), reduce.after.stateStack());
		assertEquals("A", reduce.after.formatSymbolStack());
		assertEquals(1, reduce.after.cursor);

		TraceStep last = trace.lastStep();
		assertEquals(6, last.number);
		assertTrue(last.isAccept());
		assertTrue(last.after.isAccepted());
		assertTrue(last.token.endMarker);
		assertEquals("S", last.before.formatSymbolStack());
	}

	@Test
	public void testUnexpectedEnd(){
		Simulation simulation = simulator(AB).newSimulation("a");
		assertTrue(simulation.step().isShift());
		ParseError error = assertThrows(ParseError.class, simulation::step);
		assertEquals(1, error.position);
		assertTrue(error.token.endMarker);
		assertEquals(Arrays.asList("b"), error.expected);
		assertEquals(1, error.state);
		assertEquals(2, error.trace.size());
		assertTrue(error.trace.isFailed());
		assertEquals("Error", error.trace.lastStep().describeAction());
		assertTrue(simulation.isFinished());
		assertFalse(simulation.isAccepted());
		assertEquals(SimulationState.Status.FAILED, simulation.state().status);
		assertTrue(error.getMessage().contains("position 1"));
	}

	@Test
	public void testRunKeepsTraceOnError(){
		ParseError error = assertThrows(ParseError.class, () -> simulator(AB).newSimulation("a a").run());
		assertEquals(1, error.position);
		assertEquals("a", error.token.value);
		assertEquals(new Location(1, 3), error.errorLocation);
		assertEquals(Arrays.asList("Shift 1", "Error"), error.trace.actionDescriptions());
	}

	@ParameterizedTest
	@ValueSource(strings = {"a c", "a $ b", "a B"})
	public void testUnknownToken(String input){
		ParseError error = assertThrows(ParseError.class, () -> simulator(AB).newSimulation(input).run());
		assertEquals(1, error.position);
		assertTrue(error.getMessage().contains("Unknown token"));
		assertFalse(error.token.endMarker);
	}

	@Test
	public void testStepIsPure(){
		ShiftReduceSimulator simulator = simulator(PARENS);
		List<SimulationState> states = new ArrayList<>();
		SimulationState state = simulator.initial("( ( ) ) ( )");
		states.add(state);
		List<String> actions = new ArrayList<>();
		while (!state.isFinished()){
			TraceStep step = simulator.step(state);
			actions.add(step.describeAction());
			state = step.after;
			states.add(state);
		}
		assertTrue(state.isAccepted());
		for (int i = 0; i < states.size() - 1; i++) {
			TraceStep replayed = simulator.step(states.get(i));
			assertEquals(actions.get(i), replayed.describeAction());
			assertEquals(states.get(i + 1).toString(), replayed.after.toString());
			assertEquals(i + 1, replayed.number);
		}
		SimulationState finished = state;
		assertThrows(IllegalStateException.class, () -> simulator.step(finished));
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "( )", "( ( ) ) ( )", "( ) ( ) ( )"})
	public void testEpsilonGrammarAccepts(String input){
		assertTrue(Generator.fromText(PARENS).accepts(input));
	}

	@ParameterizedTest
	@ValueSource(strings = {"(", ")", "( ( )", "( ) )"})
	public void testEpsilonGrammarRejects(String input){
		assertFalse(Generator.fromText(PARENS).accepts(input));
	}

	@Test
	public void testEmptyInput(){
		ParseTrace trace = Generator.fromText(PARENS).parse("");
		assertEquals(Arrays.asList("S → ε"), derivation(trace));
		assertEquals(2, trace.size());
		assertEquals(Arrays.asList(0, trace.get(0).gotoState().getAsInt()), trace.get(0).after.stateStack());
	}

	@Test
	public void testTokensWithoutEndMarker(){
		ShiftReduceSimulator simulator = simulator(AB);
		List<Token> tokens = Arrays.asList(new Token(0, "a", new Location(1, 1)), new Token(1, "b", new Location(1, 3)));
		SimulationState state = simulator.initial(tokens);
		assertEquals(3, state.input().size());
		assertTrue(state.input().get(2).endMarker);
		assertTrue(simulator.newSimulation(tokens).run().isAccepted());
	}

	@Test
	public void testSimulationStepAfterFinish(){
		Simulation simulation = simulator(AB).newSimulation("a b");
		simulation.run();
		assertTrue(simulation.isAccepted());
		assertThrows(IllegalStateException.class, simulation::step);
		assertEquals(6, simulation.trace().size());
	}

	@Test
	public void testStepLimit(){
		Simulation simulation = simulator(AB).newSimulation("a b");
		LRException ex = assertThrows(LRException.class, () -> simulation.run(3));
		assertFalse(ex instanceof ParseError);
		assertEquals(3, simulation.trace().size());
		assertTrue(simulator(AB).newSimulation("a b").run(6).isAccepted());
	}

	@Test
	public void testStepLimitGrowsWithInput(){
		LRParserTable table = Generator.fromText(AB).table;
		LRParser parser = new LRParser(table, 0);
		assertTrue(parser.parse("a b").isAccepted());
		assertEquals(3 * (table.stateCount() + 1), parser.stepLimit(3));
		assertEquals(Integer.MAX_VALUE, new LRParser(table, Integer.MAX_VALUE).stepLimit(1000));
	}

	private static String repeat(String token, int times){
		return String.join(" ", Collections.nCopies(times, token));
	}

	@Test
	public void testLongLeftRecursiveInput(){
		Generator generator = Generator.fromText("L -> L a | a");
		String input = repeat("a", 60000);
		assertTrue(generator.accepts(input));
		ParseTrace trace = generator.parse(input);
		assertEquals(60000, trace.derivation().size());
		assertEquals(2, trace.lastStep().before.stackSize());
	}

	@Test
	public void testDeepRightRecursiveInput(){
		ShiftReduceSimulator simulator = simulator("R -> a R | a");
		ParseTrace trace = simulator.newSimulation(repeat("a", 30000)).run();
		assertTrue(trace.isAccepted());
		assertEquals(30000, trace.derivation().size());
		SimulationState deepest = trace.get(29999).after;
		assertEquals(30001, deepest.stackSize());
		assertEquals(30001, deepest.stateStack().size());
		assertEquals(30000, deepest.symbolStack().size());
		assertEquals(2, trace.lastStep().before.stackSize());
	}

	@Test
	public void testTraceToString(){
		String str = simulator(AB).newSimulation("a b").run().toString();
		assertTrue(str.contains("Reduce 1: S → A B"));
		assertTrue(str.contains("Accept"));
	}
}
