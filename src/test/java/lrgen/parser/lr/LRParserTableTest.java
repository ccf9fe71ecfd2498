package lrgen.parser.lr;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import lrgen.grammar.Grammar;
import lrgen.grammar.GrammarParser;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class LRParserTableTest {

	static final String EXPRESSIONS = "E -> E + T | T\nT -> T * F | F\nF -> ( E ) | id";

	private static LRParserTable table(String grammar){
		return Automaton.createFromGrammar(GrammarParser.parseGrammar(grammar)).toParserTable();
	}

	@Nested
	class Conflicts {

		@Test
		public void testDanglingElse(){
			GrammarConflictError error = assertThrows(GrammarConflictError.class,
					() -> table("S -> i S | i S e S | x"));
			assertTrue(error.isShiftReduce());
			assertFalse(error.isReduceReduce());
			assertEquals("e", error.terminal.name);
			assertEquals(error.state.id, error.stateId());
			assertTrue(error.getMessage().contains("state " + error.stateId()));
			assertTrue(error.getMessage().startsWith("Shift-reduce"));
		}

		@Test
		public void testReduceReduce(){
			GrammarConflictError error = assertThrows(GrammarConflictError.class,
					() -> table("S -> A | B\nA -> a\nB -> a"));
			assertTrue(error.isReduceReduce());
			assertFalse(error.isShiftReduce());
			assertEquals("$", error.terminal.name);
		}

		@Test
		public void testAmbiguousExpressions(){
			assertThrows(GrammarConflictError.class, () -> table("E -> E + E | id"));
		}

		@Test
		public void testNoConflicts(){
			assertDoesNotThrow(() -> table(EXPRESSIONS));
			assertDoesNotThrow(() -> table("S -> C C\nC -> c C | d"));
			assertDoesNotThrow(() -> table("S -> ( S ) S | ε"));
		}
	}

	@Test
	public void testExpressionTable(){
		Grammar grammar = GrammarParser.parseGrammar(EXPRESSIONS);
		Automaton automaton = Automaton.createFromGrammar(grammar);
		LRParserTable table = automaton.toParserTable();
		Terminal id = grammar.getTerminal("id").get();
		Terminal plus = grammar.getTerminal("+").get();
		NonTerminal e = grammar.getNonTerminal("E").get();
		assertEquals(automaton.size(), table.stateCount());
		assertTrue(table.action(0, id) instanceof LRParserTable.ShiftAction);
		assertSame(LRParserTable.ERROR, table.action(0, plus));
		assertEquals(new TreeSet<>(java.util.Arrays.asList("(", "id")), names(table.expectedTerminals(0)));
		int afterE = table.gotoState(0, e).getAsInt();
		assertEquals(automaton.target(0, e).getAsInt(), afterE);
		assertTrue(table.action(afterE, grammar.eof) instanceof LRParserTable.Accept);
		assertTrue(table.action(afterE, plus) instanceof LRParserTable.ShiftAction);
		assertFalse(table.gotoState(afterE, e).isPresent());
	}

	@Test
	public void testReduceEntries(){
		Grammar grammar = GrammarParser.parseGrammar("S -> a");
		LRParserTable table = Automaton.createFromGrammar(grammar).toParserTable();
		Terminal a = grammar.getTerminal("a").get();
		int afterA = ((LRParserTable.ShiftAction)table.action(0, a)).stateToBeShifted;
		LRParserTable.Action action = table.action(afterA, grammar.eof);
		assertEquals(new LRParserTable.ReduceAction(grammar.getProduction(1)), action);
		assertEquals("reduce", action.name());
	}

	@Test
	public void testSparseEntries(){
		LRParserTable table = table("S -> a");
		// shift a in state 0, accept in the state after S, reduce in the state after a
		assertEquals(3, table.actionEntries().values().stream().mapToInt(java.util.Map::size).sum());
		assertEquals(1, table.gotoEntries().values().stream().mapToInt(java.util.Map::size).sum());
	}

	@Test
	public void testRepeatedBuildsAreEqual(){
		LRParserTable first = table(EXPRESSIONS);
		LRParserTable second = table(EXPRESSIONS);
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertEquals(first.toString(), second.toString());
		assertNotEquals(first, table("S -> a"));
	}

	private static Set<String> names(Set<Terminal> terminals){
		return terminals.stream().map(t -> t.name).collect(Collectors.toCollection(TreeSet::new));
	}
}
