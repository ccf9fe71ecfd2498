package lrgen.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import lrgen.Config;

/**
 * Parses grammar texts.
 *
 * Format: one production per line, <code>LHS -> A B c | d | ε</code>. The arrow can also be written as
 * <code>→</code>, symbols are separated by whitespace, an empty alternative or an epsilon marker is the empty
 * word. Blank lines and lines starting with <code>#</code> are ignored. A symbol is a non terminal if it is the
 * left hand side of some production, all other symbols are terminals.
 */
public class GrammarParser {

	public static final String ARROW = "->";
	public static final String UNICODE_ARROW = "→";
	public static final String ALTERNATIVE_SEPARATOR = "|";
	public static final String COMMENT_START = "#";

	private final String endMarker;
	private final Set<String> epsilonMarkers;

	public GrammarParser(String endMarker, Set<String> epsilonMarkers) {
		this.endMarker = endMarker;
		this.epsilonMarkers = epsilonMarkers;
	}

	public GrammarParser() {
		this(Config.endMarker(), Config.epsilonMarkers());
	}

	/**
	 * Parse the grammar, its start symbol is the left hand side of the first production.
	 *
	 * @return augmented grammar
	 * @throws GrammarSyntaxError on malformed lines
	 */
	public Grammar parse(String text){
		return toBuilder(text).toGrammar();
	}

	/**
	 * Parse the grammar with an explicitly given start symbol.
	 *
	 * @return augmented grammar
	 * @throws GrammarSyntaxError on malformed lines
	 * @throws UndefinedSymbolError if the start symbol has no productions
	 */
	public Grammar parse(String text, String startNonTerminal){
		return toBuilder(text).toGrammar(startNonTerminal);
	}

	public static Grammar parseGrammar(String text){
		return new GrammarParser().parse(text);
	}

	GrammarBuilder toBuilder(String text){
		GrammarBuilder builder = new GrammarBuilder(endMarker, epsilonMarkers);
		String[] lines = text.split("\r?\n", -1);
		for (int i = 0; i < lines.length; i++) {
			parseLine(builder, i + 1, lines[i]);
		}
		return builder;
	}

	private void parseLine(GrammarBuilder builder, int lineNumber, String line){
		line = line.trim();
		if (line.isEmpty() || line.startsWith(COMMENT_START)){
			return;
		}
		line = line.replace(UNICODE_ARROW, ARROW);
		int arrowIndex = line.indexOf(ARROW);
		if (arrowIndex == -1){
			throw new GrammarSyntaxError(lineNumber, String.format("Missing '%s' in \"%s\"", ARROW, line));
		}
		String left = line.substring(0, arrowIndex).trim();
		if (left.isEmpty()){
			throw new GrammarSyntaxError(lineNumber, "Empty left hand side");
		}
		String right = line.substring(arrowIndex + ARROW.length());
		if (right.contains(ARROW)){
			throw new GrammarSyntaxError(lineNumber, String.format("More than one '%s' in \"%s\"", ARROW, line));
		}
		for (String alternative : splitAlternatives(right)) {
			builder.add(lineNumber, left, splitSymbols(alternative));
		}
	}

	private List<String> splitAlternatives(String right){
		List<String> alternatives = new ArrayList<>();
		int start = 0;
		int index;
		while ((index = right.indexOf(ALTERNATIVE_SEPARATOR, start)) != -1){
			alternatives.add(right.substring(start, index));
			start = index + ALTERNATIVE_SEPARATOR.length();
		}
		alternatives.add(right.substring(start));
		return alternatives;
	}

	private List<String> splitSymbols(String alternative){
		String trimmed = alternative.trim();
		if (trimmed.isEmpty()){
			return new ArrayList<>();
		}
		return Arrays.asList(trimmed.split("\\s+"));
	}
}
