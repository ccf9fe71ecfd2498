package lrgen.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarBuilderTest {

	private static GrammarBuilder builder(){
		return new GrammarBuilder("$", Collections.singleton("ε"));
	}

	private static List<String> productions(Grammar grammar){
		return grammar.getProductions().stream().map(Production::toSimpleString).collect(Collectors.toList());
	}

	@Test
	public void testAdd(){
		Grammar grammar = builder().add("S", "A", "b").add("A", "a").add("A").toGrammar();
		assertEquals(Arrays.asList("S' → S", "S → A b", "A → a", "A → ε"), productions(grammar));
		assertEquals("S", grammar.getOriginalStart().name);
		assertTrue(grammar.getTerminal("b").isPresent());
		assertTrue(grammar.getNonTerminal("A").isPresent());
	}

	@Test
	public void testEpsilonMarkerAndDuplicates(){
		Grammar grammar = builder().add("S", "a", "S").add("S", "ε").add("S").add("S", "a", "S").toGrammar();
		assertEquals(Arrays.asList("S' → S", "S → a S", "S → ε"), productions(grammar));
	}

	@Test
	public void testExplicitStart(){
		Grammar grammar = builder().add("S", "A").add("A", "a").toGrammar("A");
		assertEquals("A", grammar.getOriginalStart().name);
	}

	@Test
	public void testInvalidSymbols(){
		assertThrows(GrammarSyntaxError.class, () -> builder().add("S", "a b"));
		assertThrows(GrammarSyntaxError.class, () -> builder().add(" ", "a"));
		assertThrows(GrammarSyntaxError.class, () -> builder().add("S", "$"));
		assertThrows(GrammarSyntaxError.class, () -> builder().toGrammar());
	}

	@Nested
	class Strict {

		@Test
		public void testDeclaredTerminals(){
			Grammar grammar = builder().terminals("a", "b").add("S", "a", "S", "b").add("S").toGrammar();
			assertEquals(1, grammar.getTerminal("a").get().id);
			assertEquals(2, grammar.getTerminal("b").get().id);
			assertEquals(3, grammar.getTerminals().size());
		}

		@Test
		public void testUnusedDeclaredTerminal(){
			Grammar grammar = builder().terminals("a", "c").add("S", "a").toGrammar();
			assertTrue(grammar.getTerminal("c").isPresent());
		}

		@Test
		public void testUndefinedRightSideSymbol(){
			UndefinedSymbolError error = assertThrows(UndefinedSymbolError.class,
					() -> builder().terminals("a").add("S", "A", "a").toGrammar());
			assertEquals("A", error.symbol);
		}

		@Test
		public void testUndefinedSymbolLine(){
			GrammarBuilder builder = builder().terminals("a").add(3, "S", Arrays.asList("a", "x"));
			UndefinedSymbolError error = assertThrows(UndefinedSymbolError.class, builder::toGrammar);
			assertEquals("x", error.symbol);
			assertTrue(error.getMessage().contains("line 3"));
		}

		@Test
		public void testDeclaredTerminalAsLeftHandSide(){
			GrammarBuilder builder = builder().terminals("a").add("S", "a").add(2, "a", Arrays.asList("a"));
			GrammarSyntaxError error = assertThrows(GrammarSyntaxError.class, builder::toGrammar);
			assertEquals(2, error.line);
		}

		@Test
		public void testWithoutDeclarationUnknownSymbolsAreTerminals(){
			Grammar grammar = builder().add("S", "A", "a").add("A", "x").toGrammar();
			assertTrue(grammar.getTerminal("x").isPresent());
		}
	}
}
