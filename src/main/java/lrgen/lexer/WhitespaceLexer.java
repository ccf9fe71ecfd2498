package lrgen.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lrgen.Config;

/**
 * Splits an input text into whitespace separated tokens and appends the end marker token.
 */
public class WhitespaceLexer {

	private final String endMarker;

	public WhitespaceLexer(String endMarker) {
		this.endMarker = endMarker;
	}

	public WhitespaceLexer() {
		this(Config.endMarker());
	}

	/**
	 * @return tokens of the input, the last one is always the end marker
	 */
	public List<Token> tokenize(String input){
		List<Token> tokens = new ArrayList<>();
		int line = 1;
		int column = 1;
		int start = -1;
		int startColumn = 0;
		for (int i = 0; i < input.length(); i++) {
			char c = input.charAt(i);
			if (Character.isWhitespace(c)){
				if (start != -1){
					tokens.add(new Token(tokens.size(), input.substring(start, i), new Location(line, startColumn)));
					start = -1;
				}
				if (c == '\n'){
					line++;
					column = 1;
					continue;
				}
			} else if (start == -1){
				start = i;
				startColumn = column;
			}
			column++;
		}
		if (start != -1){
			tokens.add(new Token(tokens.size(), input.substring(start), new Location(line, startColumn)));
		}
		tokens.add(new Token(tokens.size(), endMarker, new Location(line, column), true));
		return Collections.unmodifiableList(tokens);
	}

	/**
	 * Creates tokens for already separated token texts (one line, columns are token positions + 1).
	 */
	public List<Token> fromValues(List<String> values){
		List<Token> tokens = new ArrayList<>();
		for (String value : values){
			tokens.add(new Token(tokens.size(), value, new Location(1, tokens.size() + 1)));
		}
		tokens.add(new Token(tokens.size(), endMarker, new Location(1, tokens.size() + 1), true));
		return Collections.unmodifiableList(tokens);
	}
}
