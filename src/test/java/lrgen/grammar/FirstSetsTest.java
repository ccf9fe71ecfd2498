package lrgen.grammar;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class FirstSetsTest {

	static final String EXPRESSIONS = "E -> E + T | T\nT -> T * F | F\nF -> ( E ) | id";

	static final String NULLABLE = "S -> A B c\nA -> a | ε\nB -> b | ε";

	private static Set<String> names(Collection<? extends Symbol> symbols){
		return symbols.stream().map(s -> s.name).collect(Collectors.toCollection(TreeSet::new));
	}

	private static Set<String> set(String... names){
		return new TreeSet<>(Arrays.asList(names));
	}

	@ParameterizedTest
	@CsvSource({
			"E, ( id",
			"T, ( id",
			"F, ( id"
	})
	public void testExpressionGrammar(String nonTerminal, String expected){
		Grammar grammar = GrammarParser.parseGrammar(EXPRESSIONS);
		FirstSets firstSets = grammar.firstSets();
		assertEquals(set(expected.split(" ")), names(firstSets.first(grammar.getNonTerminal(nonTerminal).get())));
		assertTrue(firstSets.nullableNonTerminals().isEmpty());
	}

	@Test
	public void testAugmentedStart(){
		Grammar grammar = GrammarParser.parseGrammar(EXPRESSIONS);
		assertEquals(set("(", "id"), names(grammar.firstSets().first(grammar.getStart())));
	}

	@Test
	public void testNullable(){
		Grammar grammar = GrammarParser.parseGrammar(NULLABLE);
		FirstSets firstSets = grammar.firstSets();
		NonTerminal s = grammar.getNonTerminal("S").get();
		NonTerminal a = grammar.getNonTerminal("A").get();
		NonTerminal b = grammar.getNonTerminal("B").get();
		assertEquals(set("a", "b", "c"), names(firstSets.first(s)));
		assertEquals(set("a"), names(firstSets.first(a)));
		assertTrue(firstSets.isNullable(a));
		assertTrue(firstSets.isNullable(b));
		assertFalse(firstSets.isNullable(s));
		assertFalse(firstSets.isNullable(grammar.getTerminal("c").get()));
		assertEquals(set("A", "B"), names(firstSets.nullableNonTerminals()));
	}

	@Test
	public void testFirstOfSequence(){
		Grammar grammar = GrammarParser.parseGrammar(NULLABLE);
		FirstSets firstSets = grammar.firstSets();
		NonTerminal a = grammar.getNonTerminal("A").get();
		NonTerminal b = grammar.getNonTerminal("B").get();
		Terminal c = grammar.getTerminal("c").get();
		assertEquals(set("a", "b"), names(firstSets.first(Arrays.asList(a, b))));
		assertEquals(set("a", "b", "$"), names(firstSets.first(Arrays.asList(a, b), grammar.eof)));
		assertEquals(set("a", "b", "c"), names(firstSets.first(Arrays.asList(a, b, c), grammar.eof)));
		assertTrue(firstSets.isNullable(Arrays.asList(a, b)));
		assertFalse(firstSets.isNullable(Arrays.asList(a, c)));
		assertEquals(set("$"), names(firstSets.first(Arrays.<Symbol>asList(), grammar.eof)));
	}

	@Test
	public void testFixedPoint(){
		for (String text : Arrays.asList(EXPRESSIONS, NULLABLE, "S -> ( S ) S | ε")) {
			FirstSets firstSets = GrammarParser.parseGrammar(text).firstSets();
			assertTrue(firstSets.isFixedPoint());
			assertTrue(firstSets.iterations() >= 2);
		}
	}

	@Test
	public void testRecalculationIsEqual(){
		Grammar grammar = GrammarParser.parseGrammar(EXPRESSIONS);
		assertEquals(FirstSets.calculate(grammar), FirstSets.calculate(grammar));
		assertSame(grammar.firstSets(), grammar.firstSets());
	}

	@Test
	public void testToStringMarksNullable(){
		String str = GrammarParser.parseGrammar(NULLABLE).firstSets().toString();
		assertTrue(str.contains("FIRST(A)"));
		assertTrue(str.contains(Production.EPSILON));
	}
}
